package dev.animetracker.filter;

import java.util.Locale;

public enum FilterAction {
    ACCEPT,
    REJECT;

    public static FilterAction parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRuleException("Missing rule action");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleException("Unknown rule action: " + value);
        }
    }
}
