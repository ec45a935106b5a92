package dev.animetracker.filter;

/**
 * A rule definition that cannot be evaluated. Only that rule is ignored.
 */
public class InvalidRuleException extends RuntimeException {

    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
