package com.vidnyan.storytest.application.benchmark;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate timings of a benchmark run. Failed actors are listed but excluded from the statistics.
 */
public record BenchmarkResult(
    int actorCount,
    int batches,
    long totalOperations,
    long elapsedNanos,
    List<ActorTiming> timings,
    double throughput,
    double averageActorMillis,
    double minActorMillis,
    double maxActorMillis,
    double variationPercent,
    boolean contention,
    boolean bottleneck,
    List<String> warnings
) {

    /** Variation above this percentage suggests actors are interfering with each other. */
    public static final double CONTENTION_THRESHOLD_PERCENT = 150.0;

    /** Throughput below this many operations per second suggests a bottleneck. */
    public static final double BOTTLENECK_OPS_PER_SECOND = 10_000.0;

    static final long SLOW_RUN_NANOS = 10_000_000_000L;

    public BenchmarkResult {
        timings = List.copyOf(timings);
        warnings = List.copyOf(warnings);
    }

    public static BenchmarkResult from(int batches, List<ActorTiming> timings, long elapsedNanos) {
        List<ActorTiming> successful = timings.stream().filter(t -> !t.failed()).toList();
        long operations = successful.stream().mapToLong(ActorTiming::operations).sum();
        double seconds = elapsedNanos / 1_000_000_000.0;
        double throughput = seconds > 0 ? operations / seconds : 0.0;

        double average = successful.stream().mapToDouble(ActorTiming::elapsedMillis).average().orElse(0.0);
        double min = successful.stream().mapToDouble(ActorTiming::elapsedMillis).min().orElse(0.0);
        double max = successful.stream().mapToDouble(ActorTiming::elapsedMillis).max().orElse(0.0);
        double variation = average > 0 ? (max - min) / average * 100.0 : 0.0;

        boolean contention = variation > CONTENTION_THRESHOLD_PERCENT;
        boolean bottleneck = throughput < BOTTLENECK_OPS_PER_SECOND;

        List<String> warnings = new ArrayList<>();
        long failed = timings.size() - successful.size();
        if (failed > 0) {
            warnings.add(failed + " of " + timings.size() + " actors failed");
        }
        for (ActorTiming timing : successful) {
            if (average > 0 && timing.elapsedMillis() > 2 * average) {
                warnings.add(String.format("Actor %d took %.1fms, more than twice the average %.1fms",
                        timing.actorId(), timing.elapsedMillis(), average));
            }
        }
        if (contention) {
            warnings.add(String.format("Timing variation %.1f%% exceeds %.0f%%: actors likely contend",
                    variation, CONTENTION_THRESHOLD_PERCENT));
        }
        if (bottleneck) {
            warnings.add(String.format("Throughput %.0f ops/s is below %.0f ops/s",
                    throughput, BOTTLENECK_OPS_PER_SECOND));
        }
        if (elapsedNanos > SLOW_RUN_NANOS) {
            warnings.add(String.format("Run took %.1fs", seconds));
        }
        return new BenchmarkResult(timings.size(), batches, operations, elapsedNanos, timings, throughput,
                average, min, max, variation, contention, bottleneck, warnings);
    }

    public long failedActors() {
        return timings.stream().filter(ActorTiming::failed).count();
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
