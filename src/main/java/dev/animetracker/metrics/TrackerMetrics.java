package dev.animetracker.metrics;

import dev.animetracker.model.PollCycleResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the episode tracker.
 */
@Component
public class TrackerMetrics {

    private static final String TAG_SOURCE = "source";
    private final MeterRegistry registry;

    // Counters
    private final Counter releasesSeenCounter;
    private final Counter parseFailuresCounter;
    private final Counter releasesAcceptedCounter;
    private final Counter releasesRejectedCounter;
    private final Counter downloadsDispatchedCounter;
    private final Counter downloadsFailedCounter;
    private final Counter fetchFailuresCounter;
    private final Counter cycleFailuresCounter;

    // Timers
    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();
    private final Timer rpcTimer;

    // Gauges
    private final AtomicInteger lastCycleSeen = new AtomicInteger(0);
    private final AtomicInteger lastCycleAccepted = new AtomicInteger(0);
    private final AtomicInteger lastCycleDownloaded = new AtomicInteger(0);
    private final AtomicInteger lastCycleErrors = new AtomicInteger(0);

    public TrackerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.releasesSeenCounter = Counter.builder("anime_tracker_releases_seen_total")
                .description("Total release items seen across all feeds")
                .register(registry);

        this.parseFailuresCounter = Counter.builder("anime_tracker_parse_failures_total")
                .description("Release titles without an episode number")
                .register(registry);

        this.releasesAcceptedCounter = Counter.builder("anime_tracker_releases_accepted_total")
                .description("Candidates accepted by the filter rules")
                .register(registry);

        this.releasesRejectedCounter = Counter.builder("anime_tracker_releases_rejected_total")
                .description("Candidates rejected by the filter rules")
                .register(registry);

        this.downloadsDispatchedCounter = Counter.builder("anime_tracker_downloads_dispatched_total")
                .description("Downloads accepted by the download client")
                .register(registry);

        this.downloadsFailedCounter = Counter.builder("anime_tracker_downloads_failed_total")
                .description("Downloads the download client rejected or never answered")
                .register(registry);

        this.fetchFailuresCounter = Counter.builder("anime_tracker_fetch_failures_total")
                .description("Total failed feed fetches")
                .register(registry);

        this.cycleFailuresCounter = Counter.builder("anime_tracker_cycle_failures_total")
                .description("Poll cycles that did not complete")
                .register(registry);

        this.rpcTimer = Timer.builder("anime_tracker_rpc_duration")
                .description("Time spent in download client RPC calls")
                .register(registry);

        Gauge.builder("anime_tracker_last_cycle_seen", lastCycleSeen, AtomicInteger::get)
                .description("Releases seen in last cycle")
                .register(registry);

        Gauge.builder("anime_tracker_last_cycle_accepted", lastCycleAccepted, AtomicInteger::get)
                .description("Candidates accepted in last cycle")
                .register(registry);

        Gauge.builder("anime_tracker_last_cycle_downloaded", lastCycleDownloaded, AtomicInteger::get)
                .description("Downloads dispatched in last cycle")
                .register(registry);

        Gauge.builder("anime_tracker_last_cycle_errors", lastCycleErrors, AtomicInteger::get)
                .description("Errors recorded in last cycle")
                .register(registry);
    }

    /**
     * Get or create a timer for a specific feed source.
     */
    public Timer getSourceTimer(String sourceName) {
        return sourceTimers.computeIfAbsent(sourceName, name ->
                Timer.builder("anime_tracker_feed_fetch_duration")
                        .description("Time to fetch a feed")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    public void recordReleasesSeen(int count) {
        releasesSeenCounter.increment(count);
    }

    public void recordParseFailures(int count) {
        parseFailuresCounter.increment(count);
    }

    public void recordAccepted(int count) {
        releasesAcceptedCounter.increment(count);
    }

    public void recordRejected(int count) {
        releasesRejectedCounter.increment(count);
    }

    public void recordDownloadDispatched() {
        downloadsDispatchedCounter.increment();
    }

    public void recordDownloadFailed() {
        downloadsFailedCounter.increment();
    }

    public void recordCycleFailure() {
        cycleFailuresCounter.increment();
    }

    /**
     * Increment fetch failures counter for a source.
     */
    public void incrementFetchFailures(String source) {
        fetchFailuresCounter.increment();
        Counter.builder("anime_tracker_fetch_failures_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * Record fetch latency for a source.
     */
    public void recordFetchLatency(String source, long latencyMs) {
        getSourceTimer(source).record(Duration.ofMillis(latencyMs));
    }

    public void recordRpcLatency(long latencyMs) {
        rpcTimer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Update last cycle statistics.
     */
    public void updateLastCycleStats(PollCycleResult result) {
        lastCycleSeen.set(result.candidatesSeen());
        lastCycleAccepted.set(result.accepted());
        lastCycleDownloaded.set(result.downloaded());
        lastCycleErrors.set(result.errors().size());
    }
}
