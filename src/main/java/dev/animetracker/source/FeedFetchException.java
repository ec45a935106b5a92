package dev.animetracker.source;

/**
 * A feed could not be fetched or its document could not be read.
 * Recoverable: the shows depending on it are skipped until the next cycle.
 */
public class FeedFetchException extends RuntimeException {

    public FeedFetchException(String message) {
        super(message);
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
