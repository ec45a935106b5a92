package dev.animetracker.model;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one poll cycle, kept for logs, metrics and the actuator endpoint.
 */
public record PollCycleResult(
        Instant startedAt,
        Instant finishedAt,
        int showsProcessed,
        int candidatesSeen,
        int parseFailures,
        int accepted,
        int downloaded,
        int failed,
        int deferred,
        List<String> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
