package com.conveyal.velmap.util;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Runs independent units of work (frames, tracks, disjoint blocks of grid rows) either on a fixed pool of worker
 * threads or directly on the calling thread when the configured number of threads is zero. Every unit writes only to
 * its own outputs, so the number of threads has no effect on results.
 *
 * All methods block until every submitted unit has finished. If any unit fails, the remaining ones are cancelled
 * and the first failure is rethrown on the calling thread.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WorkerPool.class);

    public interface Config {
        /** Number of worker threads, zero to run all work on the calling thread. */
        int workerThreads ();
    }

    /** Processes the half-open range of indexes [from, to). */
    public interface ChunkTask {
        void process (int from, int to);
    }

    /** Null when work runs on the calling thread. */
    private final ExecutorService executor;

    public WorkerPool (Config config) {
        this(config.workerThreads());
    }

    public WorkerPool (int threads) {
        checkArgument(threads >= 0, "Number of worker threads must not be negative.");
        if (threads > 0) {
            LOG.info("Starting pool of {} worker threads.", threads);
            executor = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
                    .setNameFormat("velmap-worker-%d")
                    .setDaemon(true)
                    .build());
        } else {
            executor = null;
        }
    }

    public static WorkerPool inline () {
        return new WorkerPool(0);
    }

    public boolean isParallel () {
        return executor != null;
    }

    /**
     * Apply the function to every item and return the results in the same order as the items.
     */
    public <T, R> List<R> map (List<T> items, Function<T, R> function) {
        List<R> results = new ArrayList<>(items.size());
        if (!isParallel()) {
            for (T item : items) {
                results.add(function.apply(item));
            }
            return results;
        }
        List<Future<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(executor.submit(() -> function.apply(item)));
        }
        for (Future<R> future : futures) {
            results.add(await(future, futures));
        }
        return results;
    }

    /**
     * Split the index range [0, n) into consecutive chunks of at most chunkSize indexes and process each one.
     * Chunks never overlap.
     */
    public void forEachChunk (int n, int chunkSize, ChunkTask task) {
        checkArgument(chunkSize > 0, "Chunk size must be positive.");
        if (!isParallel()) {
            for (int from = 0; from < n; from += chunkSize) {
                task.process(from, Math.min(n, from + chunkSize));
            }
            return;
        }
        List<Future<?>> futures = new ArrayList<>();
        for (int from = 0; from < n; from += chunkSize) {
            final int chunkFrom = from;
            final int chunkTo = Math.min(n, from + chunkSize);
            futures.add(executor.submit(() -> task.process(chunkFrom, chunkTo)));
        }
        for (Future<?> future : futures) {
            await(future, futures);
        }
    }

    private static <R> R await (Future<R> future, List<? extends Future<?>> allFutures) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            allFutures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for worker threads.", e);
        } catch (ExecutionException e) {
            allFutures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            LOG.error("Worker task failed: {}", ExceptionUtils.shortCauseString(cause));
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(cause);
        }
    }

    @Override
    public void close () {
        if (isParallel()) {
            executor.shutdownNow();
        }
    }

}
