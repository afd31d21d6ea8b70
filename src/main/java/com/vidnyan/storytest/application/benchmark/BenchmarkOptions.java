package com.vidnyan.storytest.application.benchmark;

import java.time.Duration;

/**
 * @param actorsPerBatch actors in each batch
 * @param batches        number of batches; all batches share one start gate
 * @param iterationsPerActor workload repetitions inside each actor's measured pass
 * @param warmup         run each actor's workload once before the gate opens
 * @param timeout        upper bound for actors to become ready and to finish
 */
public record BenchmarkOptions(
    int actorsPerBatch,
    int batches,
    int iterationsPerActor,
    boolean warmup,
    Duration timeout
) {

    public static final int DEFAULT_ACTORS_PER_BATCH = 9;
    public static final int DEFAULT_BATCHES = 3;
    public static final int DEFAULT_ITERATIONS_PER_ACTOR = 25;

    public BenchmarkOptions {
        if (actorsPerBatch < 1 || batches < 1) {
            throw new IllegalArgumentException("Need at least one actor and one batch, got "
                    + actorsPerBatch + " x " + batches);
        }
        if (iterationsPerActor < 1) {
            throw new IllegalArgumentException("Need at least one iteration per actor, got " + iterationsPerActor);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
    }

    public static BenchmarkOptions defaults() {
        return new BenchmarkOptions(DEFAULT_ACTORS_PER_BATCH, DEFAULT_BATCHES, DEFAULT_ITERATIONS_PER_ACTOR,
                true, Duration.ofMinutes(2));
    }

    public int totalActors() {
        return actorsPerBatch * batches;
    }
}
