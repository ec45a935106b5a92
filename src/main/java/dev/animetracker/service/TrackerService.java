package dev.animetracker.service;

import dev.animetracker.config.TrackerProperties;
import dev.animetracker.dispatch.DispatchException;
import dev.animetracker.dispatch.DownloadDispatcher;
import dev.animetracker.dispatch.MagnetLinks;
import dev.animetracker.entity.FilterRule;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.filter.Decision;
import dev.animetracker.filter.FilterEngine;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.FeedBatch;
import dev.animetracker.model.ParsedRelease;
import dev.animetracker.model.PollCycleResult;
import dev.animetracker.model.RawItem;
import dev.animetracker.model.ReleaseCandidate;
import dev.animetracker.parser.ReleaseParseException;
import dev.animetracker.parser.ReleaseTitleParser;
import dev.animetracker.repository.TrackedShowRepository;
import dev.animetracker.selector.MatchSelector;
import dev.animetracker.selector.NoCandidateException;
import dev.animetracker.selector.Selection;
import dev.animetracker.source.FeedCollector;
import dev.animetracker.source.FeedFetchException;
import dev.animetracker.source.FeedSource;
import dev.animetracker.source.impl.NyaaRssSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One poll cycle across every enabled show: fetch, parse, match, filter, select, dispatch.
 *
 * <p>Shows run concurrently up to the configured bound and fail independently. Within a show,
 * wanted episodes are handled in ascending order. A missing episode does not hold back later
 * ones; it stays wanted for the next cycles.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackerService {

    private static final String SEPARATOR = "========================================";

    private final List<FeedSource> feedSources;
    private final TrackedShowRepository trackedShowRepository;
    private final ReleaseTitleParser titleParser;
    private final ShowMatcher showMatcher;
    private final FilterEngine filterEngine;
    private final FilterRuleService filterRuleService;
    private final MatchSelector matchSelector;
    private final DownloadDispatcher downloadDispatcher;
    private final HistoryService historyService;
    private final TrackerProperties trackerProperties;
    private final TrackerMetrics metrics;

    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicReference<PollCycleResult> lastResult = new AtomicReference<>();
    private final AtomicReference<Instant> lastPollTime = new AtomicReference<>();

    /**
     * Run one cycle. Per-show failures end up in the result's errors; the returned Mono only
     * fails when the tracked shows cannot be loaded at all.
     */
    public Mono<PollCycleResult> runCycle() {
        log.info(SEPARATOR);
        log.info("Poll cycle starting");
        log.info(SEPARATOR);
        log.info("Feed sources: {}", feedSources.stream().map(FeedSource::getId).toList());
        log.info("Dry run mode: {}", trackerProperties.isDryRun());

        return Mono.fromCallable(this::prepare)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(cycle -> Flux.fromIterable(cycle.shows())
                        .takeWhile(show -> !stopping.get())
                        .flatMap(show -> processShow(show, cycle)
                                        .onErrorResume(e -> {
                                            log.error("{} failed: {}", show.getTitle(), e.getMessage(), e);
                                            cycle.stats().error(show.getTitle() + ": " + e.getMessage());
                                            return Mono.empty();
                                        }),
                                Math.max(1, trackerProperties.getShowConcurrency()))
                        .then(Mono.fromCallable(() -> finish(cycle))));
    }

    private Cycle prepare() {
        List<TrackedShow> shows = trackedShowRepository.findByEnabledTrue();
        List<FilterRule> globalRules = filterRuleService.globalRules();
        log.info("Tracked shows: {}, global rules: {}", shows.size(), globalRules.size());
        return new Cycle(shows, globalRules, new FeedCollector(feedSources), new CycleStats(),
                new ConcurrentHashMap<>());
    }

    private Mono<Void> processShow(TrackedShow show, Cycle cycle) {
        List<String> sourceIds = show.getFeedSources().isEmpty()
                ? List.of(NyaaRssSource.ID)
                : List.copyOf(show.getFeedSources());

        // batches keep the show's feed order, which first-seen ranking relies on
        return Flux.fromIterable(sourceIds)
                .flatMapSequential(sourceId -> cycle.feeds().fetch(sourceId, show)
                        .onErrorResume(FeedFetchException.class, e -> {
                            cycle.stats().error(show.getTitle() + " [" + sourceId + "]: " + e.getMessage());
                            return Mono.empty();
                        }))
                .collectList()
                .publishOn(Schedulers.boundedElastic())
                .doOnNext(batches -> {
                    if (batches.isEmpty()) {
                        log.warn("{}: no feed could be read, skipping this cycle", show.getTitle());
                        return;
                    }
                    handleShow(show, batches, cycle);
                })
                .then();
    }

    private void handleShow(TrackedShow show, List<FeedBatch> batches, Cycle cycle) {
        List<FilterRule> rules = filterRuleService.rulesFor(show, cycle.globalRules());
        Set<Integer> owned = historyService.successfulEpisodes(show.getId());

        Map<Integer, List<ReleaseCandidate>> byEpisode = new TreeMap<>();
        int seen = 0;
        for (FeedBatch batch : batches) {
            for (RawItem item : batch.items()) {
                int position = seen++;
                Optional<ParsedRelease> parsed = parse(item.getTitle(), cycle);
                if (parsed.isEmpty()) {
                    continue;
                }
                ReleaseCandidate candidate = toCandidate(item, parsed.get());
                if (candidate == null || !showMatcher.matches(candidate, show)) {
                    continue;
                }
                // feed-local index replaced by the show-wide one
                candidate.setPosition(position);
                if (candidate.isBatch()) {
                    log.debug("{}: ignoring batch release '{}'", show.getTitle(), candidate.getRawTitle());
                    continue;
                }
                if (!isWanted(show, candidate.getEpisode(), owned)) {
                    continue;
                }
                byEpisode.computeIfAbsent(candidate.getEpisode(), episode -> new ArrayList<>()).add(candidate);
            }
        }
        cycle.stats().showProcessed();

        if (byEpisode.isEmpty()) {
            log.debug("{}: nothing new (watermark {})", show.getTitle(), show.getLastDownloadedEpisode());
            return;
        }

        byEpisode.forEach((episode, candidates) -> handleEpisode(show, episode, candidates, rules, cycle));
    }

    private void handleEpisode(TrackedShow show, int episode, List<ReleaseCandidate> candidates,
                               List<FilterRule> rules, Cycle cycle) {
        List<ReleaseCandidate> accepted = new ArrayList<>();
        for (ReleaseCandidate candidate : candidates) {
            Decision decision = filterEngine.evaluate(candidate, show, rules);
            if (decision.accepted()) {
                accepted.add(candidate);
            } else {
                log.debug("{} episode {}: rejected '{}' ({})", show.getTitle(), episode,
                        candidate.getRawTitle(), decision.reason());
            }
        }
        cycle.stats().accepted(accepted.size());
        metrics.recordAccepted(accepted.size());
        metrics.recordRejected(candidates.size() - accepted.size());

        Selection selection;
        try {
            selection = matchSelector.select(accepted, show);
        } catch (NoCandidateException e) {
            log.debug("{} episode {}: {}", show.getTitle(), episode, e.getMessage());
            return;
        }

        ReleaseCandidate chosen = selection.candidate();
        if (selection.ambiguous() && trackerProperties.isRequireConfirmationOnTie()) {
            log.info("{} episode {}: several releases tie with '{}', waiting for confirmation",
                    show.getTitle(), episode, chosen.getRawTitle());
            cycle.stats().deferred();
            return;
        }

        if (trackerProperties.isDryRun()) {
            log.info("DRY RUN - would download {} episode {}: '{}' [{}]", show.getTitle(), episode,
                    chosen.getRawTitle(), chosen.getSourceName());
            return;
        }

        try {
            downloadDispatcher.submit(chosen, show).ifPresent(record -> cycle.stats().downloaded());
        } catch (DispatchException e) {
            cycle.stats().failed();
            cycle.stats().error(show.getTitle() + " episode " + episode + ": " + e.getMessage());
        }
    }

    /**
     * An episode is wanted when it is past the show's baseline and not downloaded yet.
     * Episodes skipped over by a later download stay wanted.
     */
    boolean isWanted(TrackedShow show, int episode, Set<Integer> downloadedEpisodes) {
        return episode > show.getBaselineEpisode() && !downloadedEpisodes.contains(episode);
    }

    private Optional<ParsedRelease> parse(String title, Cycle cycle) {
        // Shared feeds are parsed once per cycle, not once per show
        return cycle.titles().computeIfAbsent(title, raw -> {
            cycle.stats().candidateSeen();
            metrics.recordReleasesSeen(1);
            try {
                return Optional.of(titleParser.parse(raw));
            } catch (ReleaseParseException e) {
                log.debug("Skipping unparseable release: {}", e.getMessage());
                cycle.stats().parseFailure();
                metrics.recordParseFailures(1);
                return Optional.empty();
            }
        });
    }

    /**
     * Build a candidate from a feed item. Null when the item has nothing to download.
     */
    ReleaseCandidate toCandidate(RawItem item, ParsedRelease parsed) {
        String infoHash = blankToNull(item.getInfoHash());
        String magnet = blankToNull(item.getMagnetLink());
        String torrent = blankToNull(item.getTorrentLink());

        String downloadUri;
        if (magnet != null) {
            downloadUri = magnet;
        } else if (infoHash != null) {
            downloadUri = MagnetLinks.fromInfoHash(infoHash, item.getTitle());
        } else {
            downloadUri = torrent;
        }
        if (downloadUri == null) {
            return null;
        }

        String contentId;
        if (infoHash != null) {
            contentId = infoHash.toLowerCase(Locale.ROOT);
        } else if (torrent != null) {
            contentId = "torrent:" + torrent;
        } else {
            contentId = magnet;
        }

        return ReleaseCandidate.builder()
                .rawTitle(item.getTitle())
                .showGuess(parsed.showTitle())
                .season(parsed.season())
                .episode(parsed.episode())
                .batch(parsed.isBatch())
                .group(parsed.group().isEmpty() ? item.getGroup() : parsed.group())
                .resolution(parsed.resolutionValue())
                .contentId(contentId)
                .downloadUri(downloadUri)
                .sourceName(item.getSourceName())
                .origin(item.getOrigin())
                .position(item.getPosition())
                .publishedAt(item.getPublishedAt())
                .build();
    }

    private PollCycleResult finish(Cycle cycle) {
        PollCycleResult result = cycle.stats().toResult();
        lastResult.set(result);
        lastPollTime.set(result.finishedAt());
        metrics.updateLastCycleStats(result);

        log.info(SEPARATOR);
        log.info("CYCLE SUMMARY: {} show(s), {} release(s) seen, {} unparseable, {} accepted, "
                        + "{} downloaded, {} failed, {} deferred, {} feed fetch(es)",
                result.showsProcessed(), result.candidatesSeen(), result.parseFailures(), result.accepted(),
                result.downloaded(), result.failed(), result.deferred(), cycle.feeds().distinctFetches());
        result.errors().forEach(error -> log.warn("  - {}", error));
        log.info(SEPARATOR);
        return result;
    }

    /**
     * Stop picking up shows. The shows already started run to completion.
     */
    public void requestStop() {
        stopping.set(true);
    }

    public boolean isStopping() {
        return stopping.get();
    }

    public Optional<PollCycleResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    public Optional<Instant> getLastPollTime() {
        return Optional.ofNullable(lastPollTime.get());
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record Cycle(List<TrackedShow> shows, List<FilterRule> globalRules, FeedCollector feeds,
                         CycleStats stats, Map<String, Optional<ParsedRelease>> titles) {
    }
}
