package com.vidnyan.storytest.domain.report;

import com.vidnyan.storytest.domain.rule.Violation;

import java.util.List;

/**
 * Violations and notes produced by one phase.
 */
public record PhaseResult(
    String name,
    PhaseState state,
    List<Violation> violations,
    List<String> notes,
    int candidatesEvaluated,
    int ruleFaults
) {

    public PhaseResult {
        violations = List.copyOf(violations);
        notes = List.copyOf(notes);
    }

    public static PhaseResult disabled(String name) {
        return new PhaseResult(name, PhaseState.DISABLED, List.of(),
                List.of("Phase disabled by configuration"), 0, 0);
    }

    public int violationCount() {
        return violations.size();
    }
}
