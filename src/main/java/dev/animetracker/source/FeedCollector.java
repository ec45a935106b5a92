package dev.animetracker.source;

import dev.animetracker.entity.TrackedShow;
import dev.animetracker.model.FeedBatch;
import dev.animetracker.model.FeedRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Feed access for one poll cycle. Every distinct request is fetched once and the result,
 * success or failure, is shared by all shows asking for it. Discarded at the end of the cycle.
 */
@Slf4j
public class FeedCollector {

    private final Map<String, FeedSource> sources = new LinkedHashMap<>();
    private final Map<FeedRequest, Mono<FeedBatch>> fetches = new ConcurrentHashMap<>();

    public FeedCollector(List<FeedSource> feedSources) {
        feedSources.forEach(source -> sources.put(source.getId(), source));
    }

    public Mono<FeedBatch> fetch(String sourceId, TrackedShow show) {
        FeedSource source = sources.get(sourceId);
        if (source == null) {
            return Mono.error(new FeedFetchException("Unknown feed source '" + sourceId + "'"));
        }
        FeedRequest request = source.requestFor(show);
        return fetches.computeIfAbsent(request, r -> {
            log.debug("Fetching {} for {}", source.getName(), r);
            return source.fetch(r).cache();
        });
    }

    public int distinctFetches() {
        return fetches.size();
    }
}
