package com.vidnyan.storytest.application.benchmark;

import com.vidnyan.storytest.application.port.in.ValidateAssembliesUseCase;
import com.vidnyan.storytest.domain.model.AssemblyHandle;
import com.vidnyan.storytest.domain.report.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs many actors in parallel, released together by a shared start gate, and reports
 * how evenly they finished. Diagnostic only.
 */
@Slf4j
@RequiredArgsConstructor
public class ConcurrencyBenchmarkHarness {

    private final BenchmarkOptions options;

    /**
     * Actor that runs one validation per iteration, counting evaluated candidates as operations.
     * On iteration {@code n} actor {@code i} uses partition {@code (i + n) % partitions.size()}.
     */
    public BenchmarkActor orchestratorActor(ValidateAssembliesUseCase validator,
                                            List<List<AssemblyHandle>> partitions) {
        if (partitions.isEmpty()) {
            throw new IllegalArgumentException("At least one partition is required");
        }
        List<List<AssemblyHandle>> copy = List.copyOf(partitions);
        int iterations = options.iterationsPerActor();
        return actorId -> {
            long operations = 0;
            for (int i = 0; i < iterations; i++) {
                ValidationReport report = validator.validate(copy.get((actorId + i) % copy.size()));
                operations += report.candidatesEvaluated();
            }
            return operations;
        };
    }

    public BenchmarkResult run(BenchmarkActor actor) {
        int total = options.totalActors();
        log.info("Starting benchmark: {} actors x {} batches, {} iterations each",
                options.actorsPerBatch(), options.batches(), options.iterationsPerActor());

        ExecutorService executor = Executors.newFixedThreadPool(total);
        CountDownLatch readyLatch = new CountDownLatch(total);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<ActorTiming>> futures = new ArrayList<>();
        try {
            for (int batch = 0; batch < options.batches(); batch++) {
                for (int slot = 0; slot < options.actorsPerBatch(); slot++) {
                    int actorId = batch * options.actorsPerBatch() + slot;
                    int batchIndex = batch;
                    futures.add(executor.submit(
                            () -> runActor(actor, actorId, batchIndex, readyLatch, startLatch)));
                }
            }

            long timeoutMillis = options.timeout().toMillis();
            if (!readyLatch.await(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new BenchmarkException("Actors not ready within " + options.timeout());
            }
            long begin = System.nanoTime();
            startLatch.countDown();

            List<ActorTiming> timings = new ArrayList<>();
            for (Future<ActorTiming> future : futures) {
                timings.add(future.get(timeoutMillis, TimeUnit.MILLISECONDS));
            }
            long elapsed = System.nanoTime() - begin;

            BenchmarkResult result = BenchmarkResult.from(options.batches(), timings, elapsed);
            log.info("Benchmark complete: {} ops in {}ms ({} ops/s), variation {}%",
                    result.totalOperations(), Math.round(result.elapsedMillis()),
                    Math.round(result.throughput()), Math.round(result.variationPercent()));
            result.warnings().forEach(w -> log.warn("  {}", w));
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BenchmarkException("Benchmark interrupted", e);
        } catch (TimeoutException e) {
            throw new BenchmarkException("Actors did not finish within " + options.timeout(), e);
        } catch (ExecutionException e) {
            throw new BenchmarkException("Actor task failed unexpectedly", e.getCause());
        } finally {
            startLatch.countDown();
            executor.shutdownNow();
        }
    }

    private ActorTiming runActor(BenchmarkActor actor, int actorId, int batch,
                                 CountDownLatch readyLatch, CountDownLatch startLatch) {
        Throwable warmupError = null;
        try {
            if (options.warmup()) {
                actor.run(actorId);
            }
        } catch (Throwable e) {
            rethrowIfFatal(e);
            warmupError = e;
        } finally {
            readyLatch.countDown();
        }
        try {
            startLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActorTiming.failure(actorId, batch, e);
        }
        if (warmupError != null) {
            log.warn("Actor {} failed during warm-up: {}", actorId, warmupError.toString());
            return ActorTiming.failure(actorId, batch, warmupError);
        }
        long begin = System.nanoTime();
        try {
            long operations = actor.run(actorId);
            return ActorTiming.success(actorId, batch, System.nanoTime() - begin, operations);
        } catch (Throwable e) {
            rethrowIfFatal(e);
            log.warn("Actor {} failed: {}", actorId, e.toString());
            return ActorTiming.failure(actorId, batch, e);
        }
    }

    /**
     * A stack overflow stays confined to the actor that hit it; other VM errors end the run.
     */
    private static void rethrowIfFatal(Throwable error) {
        if (error instanceof VirtualMachineError && !(error instanceof StackOverflowError)) {
            throw (VirtualMachineError) error;
        }
    }
}
