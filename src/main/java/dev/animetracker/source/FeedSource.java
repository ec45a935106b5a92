package dev.animetracker.source;

import dev.animetracker.entity.TrackedShow;
import dev.animetracker.model.FeedBatch;
import dev.animetracker.model.FeedOrigin;
import dev.animetracker.model.FeedRequest;
import reactor.core.publisher.Mono;

/**
 * Interface for release feeds.
 * Each upstream (RSS feed, scraped listing) implements this interface.
 */
public interface FeedSource {

    /**
     * Id used by tracked shows to select this feed (e.g. "nyaa", "subsplease").
     */
    String getId();

    /**
     * Display name used in logs and metrics.
     */
    String getName();

    FeedOrigin getOrigin();

    /**
     * Describe what to fetch for a show. Shows producing equal requests share one fetch per cycle.
     */
    FeedRequest requestFor(TrackedShow show);

    /**
     * Fetch and normalize the feed. Fails with {@link FeedFetchException} when the upstream is
     * unreachable, answers with an error status, or returns a malformed document.
     */
    Mono<FeedBatch> fetch(FeedRequest request);
}
