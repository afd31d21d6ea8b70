package com.vidnyan.storytest.application.benchmark;

/**
 * One independent unit of benchmark work.
 */
@FunctionalInterface
public interface BenchmarkActor {

    /**
     * Run the workload for the given actor.
     *
     * @return number of operations performed
     */
    long run(int actorId) throws Exception;
}
