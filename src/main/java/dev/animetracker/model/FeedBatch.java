package dev.animetracker.model;

import java.util.List;

/**
 * Items fetched from one feed in one cycle.
 *
 * @param skipped number of malformed items dropped while normalizing
 */
public record FeedBatch(String sourceName, FeedOrigin origin, List<RawItem> items, int skipped) {

    public static FeedBatch empty(String sourceName, FeedOrigin origin) {
        return new FeedBatch(sourceName, origin, List.of(), 0);
    }
}
