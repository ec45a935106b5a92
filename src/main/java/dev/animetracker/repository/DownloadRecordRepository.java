package dev.animetracker.repository;

import dev.animetracker.entity.DownloadOutcome;
import dev.animetracker.entity.DownloadRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Repository for download attempts.
 */
@Repository
public interface DownloadRecordRepository extends JpaRepository<DownloadRecord, Long> {

    /**
     * Check if an episode of a show already has a record with the given outcome.
     */
    boolean existsByShowIdAndEpisodeAndOutcome(Long showId, int episode, DownloadOutcome outcome);

    /**
     * Check if a release was already handed to the download client.
     */
    boolean existsByContentIdAndOutcome(String contentId, DownloadOutcome outcome);

    /**
     * Episodes of a show that were downloaded successfully.
     */
    @Query("SELECT d.episode FROM DownloadRecord d WHERE d.showId = :showId "
            + "AND d.outcome = dev.animetracker.entity.DownloadOutcome.SUCCESS")
    Set<Integer> findSuccessfulEpisodes(Long showId);

    List<DownloadRecord> findByShowIdOrderByCreatedAtDesc(Long showId);

    /**
     * Count records with an outcome created after a point in time.
     */
    long countByOutcomeAndCreatedAtAfter(DownloadOutcome outcome, LocalDateTime after);

    /**
     * Delete records older than a certain date (for cleanup).
     */
    long deleteByOutcomeAndCreatedAtBefore(DownloadOutcome outcome, LocalDateTime date);
}
