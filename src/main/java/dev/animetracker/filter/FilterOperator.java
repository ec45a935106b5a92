package dev.animetracker.filter;

import java.util.Locale;

/**
 * How a rule's pattern is compared with the field value.
 */
public enum FilterOperator {
    /** Case-insensitive equality. */
    EQUALS(false),
    /** Case-insensitive substring. */
    CONTAINS(false),
    /** Case-insensitive regular expression, found anywhere in the value. */
    MATCHES(false),
    /** Numeric value greater than or equal to the pattern. */
    AT_LEAST(true),
    /** Numeric value strictly lower than the pattern. */
    BELOW(true);

    private final boolean numeric;

    FilterOperator(boolean numeric) {
        this.numeric = numeric;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public static FilterOperator parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRuleException("Missing rule operator");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("Unknown rule operator: " + value);
        }
    }
}
