package dev.animetracker.dispatch;

/**
 * The download client did not accept a release: unreachable, timed out, rejected the
 * credentials or answered with an error. The episode is retried on the next cycle.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
