package com.nsqlexec.runner;

import com.nsqlexec.data.CheckpointWriter;
import com.nsqlexec.data.Example;
import com.nsqlexec.eval.AnswerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Processes a set of examples on a fixed pool of workers.
 *
 * <p>Examples are partitioned statically ({@link Partitioner}); each worker builds its own
 * {@link WorkerContext} and processes its partition sequentially. An exception, stack overflow or
 * out-of-memory error while processing one example is logged and recorded as a failed result; it never stops the worker. When its
 * partition is done, a worker writes one checkpoint with all its results. After all workers
 * have finished, results are merged in dataset order and scored.
 */
public class PartitionedRunner {

    private static final Logger logger = LoggerFactory.getLogger(PartitionedRunner.class);

    private final int workers;
    private final WorkerContextFactory contextFactory;
    private final ExampleProcessor processor;
    private final AnswerEvaluator evaluator;
    private final CheckpointWriter checkpointWriter;

    /**
     * @param checkpointWriter where workers dump their results, or null for no checkpoints
     */
    public PartitionedRunner(int workers, WorkerContextFactory contextFactory, ExampleProcessor processor,
                             AnswerEvaluator evaluator, CheckpointWriter checkpointWriter) {
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workers);
        }
        this.workers = workers;
        this.contextFactory = contextFactory;
        this.processor = processor;
        this.evaluator = evaluator;
        this.checkpointWriter = checkpointWriter;
    }

    public RunSummary run(List<Example> examples) throws RunnerException {
        List<List<Example>> partitions = Partitioner.partition(examples, workers);
        logger.info("Processing {} examples on {} workers", examples.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, namedThreads());
        List<Future<List<ExampleResult>>> futures = new ArrayList<>(workers);
        try {
            for (int w = 0; w < workers; w++) {
                final int workerId = w;
                final List<Example> partition = partitions.get(w);
                futures.add(pool.submit(() -> runWorker(workerId, partition)));
            }

            List<List<ExampleResult>> workerResults = new ArrayList<>(workers);
            for (int w = 0; w < workers; w++) {
                try {
                    workerResults.add(futures.get(w).get());
                } catch (ExecutionException e) {
                    throw new RunnerException("Worker#" + w + " failed", e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RunnerException("Interrupted while waiting for worker#" + w, e);
                }
            }
            return RunSummary.score(merge(examples, workerResults), evaluator);
        } finally {
            pool.shutdownNow();
        }
    }

    List<ExampleResult> runWorker(int workerId, List<Example> partition) {
        WorkerContext context = contextFactory.create(workerId);
        List<ExampleResult> results = new ArrayList<>(partition.size());
        int done = 0;
        for (Example example : partition) {
            logger.info("Worker#{}: eid {} ({}/{})", workerId, example.getEid(), ++done, partition.size());
            try {
                results.add(processor.process(example, context));
            } catch (RuntimeException e) {
                results.add(failed(workerId, example, context, e));
            } catch (Error e) {
                // stack and heap exhaustion stay with the example; other VM errors end the run
                if (e instanceof VirtualMachineError
                        && !(e instanceof StackOverflowError || e instanceof OutOfMemoryError)) {
                    throw e;
                }
                results.add(failed(workerId, example, context, e));
            }
        }

        if (checkpointWriter != null) {
            try {
                Path file = checkpointWriter.write(workerId, results);
                logger.info("Worker#{}: checkpoint written to {}", workerId, file);
            } catch (IOException e) {
                logger.error("Worker#{}: could not write checkpoint: {}", workerId, e.getMessage());
            }
        }
        return results;
    }

    private static ExampleResult failed(int workerId, Example example, WorkerContext context, Throwable error) {
        logger.warn("Worker#{}: eid {} failed, recording sentinel result", workerId, example.getEid(), error);
        return ExampleResult.failed(example.getEid(), example.getQuestion(), example.getGoldAnswer(),
                error.toString(), context.getPolicy().getAnswerPlaceholder());
    }

    /**
     * Union of the per-worker results, in the order of {@code examples}.
     */
    static List<ExampleResult> merge(List<Example> examples, List<List<ExampleResult>> workerResults)
            throws RunnerException {
        Map<String, ExampleResult> byEid = new HashMap<>();
        for (List<ExampleResult> results : workerResults) {
            for (ExampleResult result : results) {
                if (byEid.put(result.getEid(), result) != null) {
                    throw new RunnerException("Example " + result.getEid() + " was processed by more than one worker");
                }
            }
        }
        List<ExampleResult> merged = new ArrayList<>(byEid.size());
        for (Example example : examples) {
            ExampleResult result = byEid.remove(example.getEid());
            if (result != null) {
                merged.add(result);
            }
        }
        if (!byEid.isEmpty()) {
            throw new RunnerException("Results for unknown examples: " + byEid.keySet());
        }
        return merged;
    }

    private static java.util.concurrent.ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "nsql-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
