package dev.animetracker.filter;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The condition half of a filter rule.
 *
 * <p>Numeric patterns are either an integer or {@value #SHOW_MINIMUM}, which stands for the
 * tracked show's minimum resolution.
 */
public record RulePredicate(FilterField field, FilterOperator operator, String pattern) {

    public static final String SHOW_MINIMUM = "min";

    public boolean usesShowMinimum() {
        return SHOW_MINIMUM.equalsIgnoreCase(pattern.trim());
    }

    /**
     * Check the predicate can be evaluated.
     *
     * @throws InvalidRuleException when the pattern does not fit the field or operator
     */
    public RulePredicate validate() {
        if (field == null || operator == null) {
            throw new InvalidRuleException("Rule needs a field and an operator");
        }
        if (pattern == null || pattern.isBlank()) {
            throw new InvalidRuleException("Rule on " + field + " has an empty pattern");
        }
        if (operator.isNumeric()) {
            if (!field.isNumeric()) {
                throw new InvalidRuleException(operator + " needs a numeric field, got " + field);
            }
            if (!usesShowMinimum()) {
                parseThreshold();
            }
        }
        if (operator == FilterOperator.MATCHES) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new InvalidRuleException("Invalid regular expression: " + pattern, e);
            }
        }
        return this;
    }

    /**
     * The pattern as a numeric threshold.
     *
     * @throws InvalidRuleException when it is not a non-negative int
     */
    public int parseThreshold() {
        String value = pattern.trim();
        if (!value.matches("\\d+")) {
            throw new InvalidRuleException("Not a number: '" + pattern + "'");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidRuleException("Number out of range: '" + pattern + "'", e);
        }
    }
}
