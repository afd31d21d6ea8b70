package com.vidnyan.storytest.domain.rule;

/**
 * Result of applying one rule to one candidate.
 */
public record RuleOutcome(
    boolean violated,
    String message
) {

    private static final RuleOutcome PASS = new RuleOutcome(false, null);

    public static RuleOutcome pass() {
        return PASS;
    }

    public static RuleOutcome violation(String message) {
        return new RuleOutcome(true, message);
    }

    public static RuleOutcome violation(String format, Object... args) {
        return new RuleOutcome(true, String.format(format, args));
    }
}
