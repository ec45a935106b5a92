package dev.animetracker.model;

/**
 * Kind of upstream a release was discovered on.
 */
public enum FeedOrigin {
    /** Structured RSS feed. */
    RSS,
    /** Scraped HTML listing. */
    SCRAPE
}
