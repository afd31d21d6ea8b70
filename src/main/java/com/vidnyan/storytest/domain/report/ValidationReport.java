package com.vidnyan.storytest.domain.report;

import com.vidnyan.storytest.domain.rule.Violation;
import com.vidnyan.storytest.domain.rule.ViolationCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one validation run. Phases keep the order they ran in;
 * phases after an early stop are absent.
 */
public record ValidationReport(
    Instant startedAt,
    Instant completedAt,
    Map<String, PhaseResult> phases,
    List<String> notes,
    WalkStatistics walkStatistics,
    boolean stoppedEarly,
    boolean cancelled
) {

    public static final int PENALTY_PER_VIOLATION = 5;
    public static final int PRODUCTION_READY_SCORE = 95;

    public ValidationReport {
        phases = Collections.unmodifiableMap(new LinkedHashMap<>(phases));
        notes = List.copyOf(notes);
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    /**
     * All violations, phase by phase, in evaluation order.
     */
    public List<Violation> violations() {
        return phases.values().stream()
                .flatMap(p -> p.violations().stream())
                .toList();
    }

    public int violationCount() {
        return phases.values().stream().mapToInt(PhaseResult::violationCount).sum();
    }

    public Optional<PhaseResult> phase(String name) {
        return phases.values().stream()
                .filter(p -> p.name().equalsIgnoreCase(name))
                .findFirst();
    }

    public int candidatesEvaluated() {
        return phases.values().stream().mapToInt(PhaseResult::candidatesEvaluated).sum();
    }

    /**
     * 100 minus a fixed penalty per violation, clamped to [0, 100].
     */
    public int readinessScore() {
        return Math.max(0, Math.min(100, 100 - PENALTY_PER_VIOLATION * violationCount()));
    }

    public boolean isFullyCompliant() {
        return violationCount() == 0;
    }

    public boolean isProductionReady() {
        return readinessScore() >= PRODUCTION_READY_SCORE;
    }

    public Map<ViolationCategory, Long> violationsByCategory() {
        Map<ViolationCategory, Long> counts = new EnumMap<>(ViolationCategory.class);
        for (Violation violation : violations()) {
            counts.merge(violation.category(), 1L, Long::sum);
        }
        return counts;
    }
}
