package com.vidnyan.storytest.domain.report;

/**
 * Counters collected while walking metadata.
 */
public record WalkStatistics(
    int assembliesScanned,
    int assembliesSkipped,
    int typesVisited,
    int typesSkipped,
    int membersYielded,
    int membersSkipped,
    int exemptSymbols
) {

    public static WalkStatistics empty() {
        return new WalkStatistics(0, 0, 0, 0, 0, 0, 0);
    }
}
