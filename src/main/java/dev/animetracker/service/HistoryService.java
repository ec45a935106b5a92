package dev.animetracker.service;

import dev.animetracker.entity.DownloadOutcome;
import dev.animetracker.entity.DownloadRecord;
import dev.animetracker.entity.TrackedShow;
import dev.animetracker.model.ReleaseCandidate;
import dev.animetracker.repository.DownloadRecordRepository;
import dev.animetracker.repository.TrackedShowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Download history backed by the database. The success records are the duplicate guard:
 * an episode or a release with a SUCCESS record is never submitted again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryService {

    private final DownloadRecordRepository downloadRecordRepository;
    private final TrackedShowRepository trackedShowRepository;

    /**
     * Episodes of a show already downloaded successfully.
     */
    public Set<Integer> successfulEpisodes(Long showId) {
        return downloadRecordRepository.findSuccessfulEpisodes(showId);
    }

    public boolean hasSuccess(Long showId, int episode) {
        return downloadRecordRepository.existsByShowIdAndEpisodeAndOutcome(showId, episode, DownloadOutcome.SUCCESS);
    }

    /**
     * Check if a release was already downloaded, whatever episode it was filed under.
     */
    public boolean isContentDownloaded(String contentId) {
        return downloadRecordRepository.existsByContentIdAndOutcome(contentId, DownloadOutcome.SUCCESS);
    }

    /**
     * Store a confirmed download and move the show's watermark to max(current, episode).
     *
     * @param show the caller's copy is advanced too
     */
    @Transactional
    public DownloadRecord recordSuccess(TrackedShow show, ReleaseCandidate candidate, String message) {
        DownloadRecord record = downloadRecordRepository.save(
                toRecord(show, candidate, DownloadOutcome.SUCCESS, message));

        TrackedShow stored = trackedShowRepository.findById(show.getId()).orElse(show);
        stored.advanceWatermark(candidate.getEpisode(), candidate.getContentId());
        trackedShowRepository.save(stored);
        show.advanceWatermark(candidate.getEpisode(), candidate.getContentId());

        log.debug("Recorded download of {} episode {}, watermark now {}",
                show.getTitle(), candidate.getEpisode(), stored.getLastDownloadedEpisode());
        return record;
    }

    /**
     * Store a failed attempt. The watermark does not move.
     */
    @Transactional
    public DownloadRecord recordFailure(TrackedShow show, ReleaseCandidate candidate, String message) {
        return downloadRecordRepository.save(toRecord(show, candidate, DownloadOutcome.FAILED, message));
    }

    public List<DownloadRecord> historyFor(Long showId) {
        return downloadRecordRepository.findByShowIdOrderByCreatedAtDesc(showId);
    }

    /**
     * Get count of successful downloads today.
     */
    public long getDownloadsToday() {
        LocalDateTime startOfDay = LocalDateTime.now().toLocalDate().atStartOfDay();
        return downloadRecordRepository.countByOutcomeAndCreatedAtAfter(DownloadOutcome.SUCCESS, startOfDay);
    }

    /**
     * Clean up failed attempts older than the given number of days. Success records are kept
     * since they guard against duplicates.
     */
    @Transactional
    public long cleanupFailedRecords(int daysToKeep) {
        LocalDateTime cutoffDate = LocalDateTime.now().minusDays(daysToKeep);
        long deleted = downloadRecordRepository.deleteByOutcomeAndCreatedAtBefore(DownloadOutcome.FAILED, cutoffDate);
        log.info("Cleaned up {} failed download record(s) older than {} days", deleted, daysToKeep);
        return deleted;
    }

    private DownloadRecord toRecord(TrackedShow show, ReleaseCandidate candidate, DownloadOutcome outcome,
                                    String message) {
        return DownloadRecord.builder()
                .showId(show.getId())
                .episode(candidate.getEpisode())
                .contentId(candidate.getContentId())
                .downloadUri(candidate.getDownloadUri())
                .title(candidate.getRawTitle())
                .sourceName(candidate.getSourceName())
                .outcome(outcome)
                .message(message)
                .createdAt(LocalDateTime.now())
                .build();
    }
}
