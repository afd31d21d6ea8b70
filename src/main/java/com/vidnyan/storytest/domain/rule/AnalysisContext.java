package com.vidnyan.storytest.domain.rule;

/**
 * Read-only, run-wide facts shared by every rule evaluation.
 */
public record AnalysisContext(
    UsageIndex usages
) {

    public static AnalysisContext empty() {
        return new AnalysisContext(UsageIndex.empty());
    }

    public static AnalysisContext of(UsageIndex usages) {
        return new AnalysisContext(usages);
    }
}
