package dev.animetracker.selector;

/**
 * No acceptable release exists for an episode this cycle. A normal outcome, not a failure.
 */
public class NoCandidateException extends RuntimeException {

    public NoCandidateException(String message) {
        super(message);
    }
}
