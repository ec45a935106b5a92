package dev.animetracker.service;

import dev.animetracker.model.PollCycleResult;

import java.time.Instant;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters of one poll cycle, updated concurrently by the per-show workers.
 */
class CycleStats {

    private final Instant startedAt = Instant.now();
    private final AtomicInteger showsProcessed = new AtomicInteger();
    private final AtomicInteger candidatesSeen = new AtomicInteger();
    private final AtomicInteger parseFailures = new AtomicInteger();
    private final AtomicInteger accepted = new AtomicInteger();
    private final AtomicInteger downloaded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger deferred = new AtomicInteger();
    private final Queue<String> errors = new ConcurrentLinkedQueue<>();

    void showProcessed() {
        showsProcessed.incrementAndGet();
    }

    void candidateSeen() {
        candidatesSeen.incrementAndGet();
    }

    void parseFailure() {
        parseFailures.incrementAndGet();
    }

    void accepted(int count) {
        accepted.addAndGet(count);
    }

    void downloaded() {
        downloaded.incrementAndGet();
    }

    void failed() {
        failed.incrementAndGet();
    }

    void deferred() {
        deferred.incrementAndGet();
    }

    void error(String message) {
        errors.add(message);
    }

    PollCycleResult toResult() {
        return new PollCycleResult(startedAt, Instant.now(), showsProcessed.get(), candidatesSeen.get(),
                parseFailures.get(), accepted.get(), downloaded.get(), failed.get(), deferred.get(),
                List.copyOf(errors));
    }
}
