package io.nosqlbench.cea.psa;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.cea.checkpoint.PsaCheckpointManager;
import io.nosqlbench.cea.checkpoint.PsaCheckpointState;
import io.nosqlbench.cea.economics.StrategyOutcome;
import io.nosqlbench.cea.model.SampledParameters;
import io.nosqlbench.cea.model.config.FailurePolicy;
import io.nosqlbench.cea.model.config.RunConfig;
import io.nosqlbench.cea.model.errors.CeaException;
import io.nosqlbench.cea.model.errors.InvalidTransitionException;
import io.nosqlbench.cea.model.errors.ResumeConflictException;
import io.nosqlbench.cea.sampling.ParameterSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the probabilistic sensitivity analysis on a fixed worker pool.
 *
 * <h2>Execution</h2>
 *
 * <pre>{@code
 * ┌──────────────────────────────────────────────────────────────────────────┐
 * │ PENDING: iterations 0..N-1 not present in the resumed checkpoint         │
 * └──────────────────────────────────────────────────────────────────────────┘
 *          ↓  split into batches of batchSize
 * ┌──────────────────────────────────────────────────────────────────────────┐
 * │ BATCH (parallel)                                                         │
 * │  ┌─────────────┐ ┌─────────────┐ ┌─────────────┐                         │
 * │  │ Worker 0    │ │ Worker 1    │ │ Worker N    │   per iteration i:      │
 * │  │ local buf   │ │ local buf   │ │ local buf   │   rng(seed + i)         │
 * │  └─────────────┘ └─────────────┘ └─────────────┘   sample, simulate      │
 * └──────────────────────────────────────────────────────────────────────────┘
 *          ↓  merge buffers, log progress, write checkpoint, check cancel
 * ┌──────────────────────────────────────────────────────────────────────────┐
 * │ RESULT: draws sorted by iteration                                        │
 * └──────────────────────────────────────────────────────────────────────────┘
 * }</pre>
 *
 * <p>Each iteration depends only on the base seed and its own index, so the
 * result is the same for any thread count or completion order.
 *
 * <h2>Failures</h2>
 *
 * <p>An {@link InvalidTransitionException} aborts the run under
 * {@link FailurePolicy#ABORT}. Under {@link FailurePolicy#SKIP_AND_COUNT}
 * the iteration is recorded as failed, and the run aborts only once the
 * failed fraction exceeds the configured tolerance. Any other exception
 * always aborts.
 *
 * <h2>Cancellation</h2>
 *
 * <p>{@link #cancel()} is honoured between batches; the draws completed so
 * far are returned, and checkpointed when checkpointing is on.
 */
public final class ProbabilisticRunner {

    private static final Logger logger = LogManager.getLogger(ProbabilisticRunner.class);

    /**
     * Receives progress after every batch.
     */
    @FunctionalInterface
    public interface ProgressCallback {
        void onProgress(int completed, int total);
    }

    private final RunConfig config;
    private final ParameterSampler sampler;
    private final IterationEvaluator evaluator;
    private final List<String> strategyIds;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private ProgressCallback progressCallback;

    /**
     * @param config run settings
     * @param sampler sampler over the run's parameter table
     * @param evaluator evaluates every strategy for one draw
     * @param strategyIds strategy ids in registry order
     */
    public ProbabilisticRunner(RunConfig config, ParameterSampler sampler, IterationEvaluator evaluator,
                               List<String> strategyIds) {
        this.config = config;
        this.sampler = sampler;
        this.evaluator = evaluator;
        this.strategyIds = List.copyOf(strategyIds);
    }

    public ProbabilisticRunner onProgress(ProgressCallback callback) {
        this.progressCallback = callback;
        return this;
    }

    /**
     * Requests that the run stop at the next batch boundary.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs every iteration from scratch.
     */
    public PsaResult run() {
        return run(null);
    }

    /**
     * Loads a checkpoint and runs the iterations it does not hold.
     *
     * @param checkpoint the checkpoint file
     * @return the combined result
     * @throws IOException if the checkpoint cannot be read
     * @throws PsaCheckpointManager.CheckpointException if the checkpoint is corrupt
     * @throws ResumeConflictException if the checkpoint belongs to another run
     */
    public PsaResult resume(Path checkpoint) throws IOException, PsaCheckpointManager.CheckpointException {
        PsaCheckpointState state = PsaCheckpointManager.load(checkpoint);
        logger.info("Resuming from {} with {} of {} iterations done",
            checkpoint, state.completedIterations(), config.iterations());
        return run(state);
    }

    /**
     * Runs the iterations not already present in {@code resumeFrom}.
     *
     * @param resumeFrom a checkpoint of the same run, or null
     * @return draws ordered by iteration
     * @throws ResumeConflictException if the checkpoint belongs to another run
     * @throws InvalidTransitionException under {@link FailurePolicy#ABORT}
     */
    public PsaResult run(PsaCheckpointState resumeFrom) {
        int total = config.iterations();
        DrawCollection draws = new DrawCollection();
        if (resumeFrom != null) {
            PsaCheckpointManager.verifyCompatible(resumeFrom, config.fingerprint(), config.seed(),
                strategyIds, sampler.table().parameters());
            for (SimulationDraw draw : resumeFrom.draws()) {
                if (draw.iteration() < 0 || draw.iteration() >= total) {
                    throw new ResumeConflictException("iteration " + draw.iteration(),
                        "checkpoint iteration lies outside this run's " + total + " iterations");
                }
            }
            draws.merge(resumeFrom.draws());
            draws.markFailed(resumeFrom.failedIterations());
        }

        List<Long> pending = new ArrayList<>();
        for (long i = 0; i < total; i++) {
            if (!draws.contains(i)) {
                pending.add(i);
            }
        }
        logger.debug("Running {} iterations ({} pending) on {} threads, batch size {}",
            total, pending.size(), config.threads(), config.batchSize());

        ExecutorService executor = Executors.newFixedThreadPool(config.threads(), workerThreads());
        try {
            for (int start = 0; start < pending.size(); start += config.batchSize()) {
                if (cancelled.get()) {
                    logger.info("Run cancelled after {} of {} iterations", draws.size() + draws.failedCount(), total);
                    break;
                }
                List<Long> batch = pending.subList(start, Math.min(start + config.batchSize(), pending.size()));
                runBatch(executor, batch, draws);

                int done = draws.size() + draws.failedCount();
                checkFailureTolerance(draws);
                logger.info("Completed {}/{} iterations ({} skipped)", done, total, draws.failedCount());
                if (progressCallback != null) {
                    progressCallback.onProgress(done, total);
                }
                writeCheckpoint(draws);
            }
        } finally {
            executor.shutdownNow();
        }

        boolean complete = draws.size() + draws.failedCount() == total;
        return new PsaResult(strategyIds, sampler.table(), draws.sorted(), draws.failedIterations(), complete);
    }

    private void runBatch(ExecutorService executor, List<Long> batch, DrawCollection draws) {
        int workers = Math.min(config.threads(), batch.size());
        int sliceSize = (batch.size() + workers - 1) / workers;
        List<Future<BatchBuffer>> futures = new ArrayList<>(workers);
        for (int from = 0; from < batch.size(); from += sliceSize) {
            List<Long> slice = batch.subList(from, Math.min(from + sliceSize, batch.size()));
            futures.add(executor.submit(new SliceTask(slice)));
        }
        List<BatchBuffer> buffers = new ArrayList<>(futures.size());
        try {
            for (Future<BatchBuffer> future : futures) {
                buffers.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new CeaException("psa", "interrupted while waiting for a batch", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CeaException("psa", "iteration failed: " + cause, cause);
        }
        for (BatchBuffer buffer : buffers) {
            draws.merge(buffer.draws);
            draws.markFailed(buffer.failed);
        }
    }

    private void checkFailureTolerance(DrawCollection draws) {
        int failed = draws.failedCount();
        if (failed == 0) {
            return;
        }
        double fraction = (double) failed / (draws.size() + failed);
        if (fraction > config.failureTolerance()) {
            throw new CeaException("psa", String.format(
                "%d of %d iterations had invalid transition matrices, above the tolerance of %.1f%%",
                failed, draws.size() + failed, config.failureTolerance() * 100.0));
        }
    }

    private void writeCheckpoint(DrawCollection draws) {
        Path path = config.checkpointPath();
        if (path == null) {
            return;
        }
        PsaCheckpointState state = new PsaCheckpointState.Builder()
            .configFingerprint(config.fingerprint())
            .baseSeed(config.seed())
            .totalIterations(config.iterations())
            .strategyIds(strategyIds)
            .parameters(sampler.table().parameters())
            .draws(draws.sorted())
            .failedIterations(draws.failedIterations())
            .build();
        try {
            PsaCheckpointManager.save(path, state);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint " + path, e);
        }
    }

    private SimulationDraw runIteration(long iteration) {
        long seed = config.seedFor(iteration);
        SampledParameters parameters = sampler.sample(iteration, seed);
        StrategyOutcome[] outcomes = evaluator.evaluate(parameters);
        return SimulationDraw.of(iteration, seed, parameters.values(), outcomes);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "psa-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class BatchBuffer {
        private final List<SimulationDraw> draws = new ArrayList<>();
        private final List<Long> failed = new ArrayList<>();
    }

    private final class SliceTask implements Callable<BatchBuffer> {
        private final List<Long> iterations;

        SliceTask(List<Long> iterations) {
            this.iterations = iterations;
        }

        @Override
        public BatchBuffer call() {
            BatchBuffer buffer = new BatchBuffer();
            for (long iteration : iterations) {
                try {
                    buffer.draws.add(runIteration(iteration));
                } catch (InvalidTransitionException e) {
                    if (config.failurePolicy() == FailurePolicy.ABORT) {
                        throw e;
                    }
                    logger.warn("Skipping iteration {}: {}", iteration, e.getMessage());
                    buffer.failed.add(iteration);
                }
            }
            return buffer;
        }
    }
}
