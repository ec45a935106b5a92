package dev.animetracker.model;

/**
 * What to ask a feed source for. Two equal requests in one cycle share a single fetch.
 *
 * @param sourceId   id of the feed source
 * @param query      search text, null for feeds that are not searchable
 * @param uploader   uploader or release group to search under, may be null
 * @param resolution resolution filter in pixels, 0 when the feed does not take one
 */
public record FeedRequest(String sourceId, String query, String uploader, int resolution) {
}
