package dev.animetracker.config;

/**
 * A show definition that cannot be tracked. Only that show is skipped.
 */
public class InvalidShowException extends RuntimeException {

    public InvalidShowException(String message) {
        super(message);
    }
}
