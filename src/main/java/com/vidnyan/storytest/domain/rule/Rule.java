package com.vidnyan.storytest.domain.rule;

/**
 * A single completeness check.
 * Implementations must be pure: the same candidate and context always give the same outcome.
 */
public interface Rule {

    String id();

    String name();

    ViolationCategory category();

    /**
     * Evaluate the candidate. Rules ignore candidates they don't apply to by returning
     * {@link RuleOutcome#pass()}.
     */
    RuleOutcome evaluate(Candidate candidate, AnalysisContext context);
}
