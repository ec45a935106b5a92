package dev.animetracker.dispatch;

import dev.animetracker.config.TransmissionConfig;
import dev.animetracker.entity.DownloadRecord;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.metrics.TrackerMetrics;
import dev.animetracker.model.ReleaseCandidate;
import dev.animetracker.service.HistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands a selected release to Transmission and records the outcome.
 *
 * <p>Check, submit and record run under a per-show lock, so two workers can never both
 * submit the same (show, episode). Different shows proceed in parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DownloadDispatcher {

    private final TransmissionClient transmissionClient;
    private final HistoryService historyService;
    private final TransmissionConfig transmissionConfig;
    private final TrackerMetrics metrics;

    private final Map<Long, ReentrantLock> showLocks = new ConcurrentHashMap<>();

    /**
     * Submit a release for a show.
     *
     * @return the SUCCESS record, or empty when the episode or this exact release was already downloaded
     * @throws DispatchException when Transmission did not take the release; a FAILED record is stored first
     */
    public Optional<DownloadRecord> submit(ReleaseCandidate candidate, TrackedShow show) {
        ReentrantLock lock = showLocks.computeIfAbsent(show.getId(), id -> new ReentrantLock());
        lock.lock();
        try {
            if (historyService.hasSuccess(show.getId(), candidate.getEpisode())) {
                log.debug("{} episode {} already downloaded", show.getTitle(), candidate.getEpisode());
                return Optional.empty();
            }
            if (historyService.isContentDownloaded(candidate.getContentId())) {
                log.info("Skipping '{}': release already downloaded", candidate.getRawTitle());
                return Optional.empty();
            }

            String downloadDir = downloadDirectory(show);
            TransmissionClient.AddResult result;
            try {
                result = transmissionClient.addTorrent(candidate.getDownloadUri(), downloadDir).block();
                if (result == null) {
                    throw new DispatchException("Transmission returned no result");
                }
            } catch (DispatchException e) {
                historyService.recordFailure(show, candidate, e.getMessage());
                metrics.recordDownloadFailed();
                log.warn("Download of {} episode {} failed: {}", show.getTitle(), candidate.getEpisode(),
                        e.getMessage());
                throw e;
            }

            String message = result.duplicate() ? "Already present in Transmission" : "Added to " + downloadDir;
            DownloadRecord record = historyService.recordSuccess(show, candidate, message);
            metrics.recordDownloadDispatched();
            log.info("Dispatched {} episode {}: '{}' -> {}{}", show.getTitle(), candidate.getEpisode(),
                    candidate.getRawTitle(), downloadDir, result.duplicate() ? " (duplicate)" : "");
            return Optional.of(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@code <root>/<show title>/Season <n>/} unless the show names its own directory.
     */
    public String downloadDirectory(TrackedShow show) {
        if (show.getDownloadPath() != null && !show.getDownloadPath().isBlank()) {
            return show.getDownloadPath();
        }
        String root = transmissionConfig.getDownloadRoot();
        if (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
        String folder = show.getTitle().replace('/', ' ').trim();
        return root + "/" + folder + "/Season " + show.getSeason() + "/";
    }
}
