package dev.animetracker.filter;

import java.util.Locale;

/**
 * Candidate attribute a rule looks at.
 */
public enum FilterField {
    TITLE(false),
    SHOW(false),
    GROUP(false),
    SOURCE(false),
    RESOLUTION(true),
    EPISODE(true);

    private final boolean numeric;

    FilterField(boolean numeric) {
        this.numeric = numeric;
    }

    public boolean isNumeric() {
        return numeric;
    }

    public static FilterField parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRuleException("Missing rule field");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("Unknown rule field: " + value);
        }
    }
}
