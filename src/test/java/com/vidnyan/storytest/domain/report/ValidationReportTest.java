package com.vidnyan.storytest.domain.report;

import com.vidnyan.storytest.domain.rule.Violation;
import com.vidnyan.storytest.domain.rule.ViolationCategory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationReportTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void emptyReport_IsFullyCompliant() {
        ValidationReport report = report(phase("StoryIntegrity", 0));

        assertEquals(100, report.readinessScore());
        assertTrue(report.isFullyCompliant());
        assertTrue(report.isProductionReady());
        assertEquals(Duration.ofSeconds(2), report.duration());
    }

    @Test
    void score_DropsFivePerViolation() {
        ValidationReport report = report(phase("StoryIntegrity", 2), phase("Conceptual", 1));

        assertEquals(85, report.readinessScore());
        assertEquals(3, report.violations().size());
        assertFalse(report.isFullyCompliant());
        assertFalse(report.isProductionReady());
        assertEquals(Map.of(ViolationCategory.PLACEHOLDER_CODE, 3L), report.violationsByCategory());
    }

    @Test
    void score_IsClampedAtZero() {
        assertEquals(0, report(phase("StoryIntegrity", 25)).readinessScore());
    }

    @Test
    void violations_AreFlattenedInPhaseOrder() {
        ValidationReport report = report(phase("StoryIntegrity", 1), phase("Conceptual", 1));

        assertEquals(List.of("StoryIntegrity-0", "Conceptual-0"),
                report.violations().stream().map(Violation::memberName).toList());
        assertTrue(report.phase("conceptual").isPresent());
    }

    private static ValidationReport report(PhaseResult... phases) {
        Map<String, PhaseResult> map = new LinkedHashMap<>();
        for (PhaseResult phase : phases) {
            map.put(phase.name(), phase);
        }
        return new ValidationReport(START, START.plusSeconds(2), map, List.of(), WalkStatistics.empty(), false, false);
    }

    private static PhaseResult phase(String name, int violations) {
        List<Violation> list = new ArrayList<>();
        for (int i = 0; i < violations; i++) {
            list.add(Violation.builder()
                    .ruleId("COLD-METHOD-001")
                    .category(ViolationCategory.PLACEHOLDER_CODE)
                    .typeName("Game.Player")
                    .memberName(name + "-" + i)
                    .message("empty")
                    .build());
        }
        return new PhaseResult(name, PhaseState.COMPLETED, list, List.of(), violations, 0);
    }
}
