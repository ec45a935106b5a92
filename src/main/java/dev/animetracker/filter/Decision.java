package dev.animetracker.filter;

/**
 * Outcome of running the filter rules against one candidate.
 *
 * @param ruleName rule that decided, null when no rule matched
 */
public record Decision(boolean accepted, String reason, String ruleName) {

    public static final String NO_RULE_MATCHED = "No rule matched";

    public static Decision accept(String ruleName) {
        return new Decision(true, null, ruleName);
    }

    public static Decision reject(String ruleName, String reason) {
        return new Decision(false, reason, ruleName);
    }

    public static Decision noRuleMatched() {
        return new Decision(false, NO_RULE_MATCHED, null);
    }
}
