package dev.animetracker.parser;

/**
 * A release title without an extractable episode number. The item is skipped and counted.
 */
public class ReleaseParseException extends RuntimeException {

    public ReleaseParseException(String message) {
        super(message);
    }
}
