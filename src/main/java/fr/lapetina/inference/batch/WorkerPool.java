package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.BatchRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one worker thread per non-empty range and joins all of them before
 * returning, whether the workers succeed or not.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    /**
     * Builds the work for one range.
     */
    @FunctionalInterface
    public interface WorkerFactory<T> {
        Callable<T> create(int workerId, BatchRange range);
    }

    private final String threadPrefix;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ExecutorService executor;

    public WorkerPool(String threadPrefix) {
        this.threadPrefix = threadPrefix;
    }

    public WorkerPool() {
        this("batch-worker");
    }

    /**
     * Runs the workers and waits for every one of them.
     *
     * @return worker results in range order
     * @throws BatchExecutionException carrying the first failure, once all
     *                                 workers have finished
     */
    public <T> List<T> run(List<BatchRange> ranges, WorkerFactory<T> factory) {
        if (closed.get()) {
            throw new IllegalStateException("Worker pool is closed");
        }

        List<BatchRange> work = ranges.stream().filter(r -> !r.isEmpty()).toList();
        if (work.isEmpty()) {
            log.debug("No work to run");
            return List.of();
        }

        ExecutorService pool = Executors.newFixedThreadPool(work.size(), new WorkerThreadFactory(threadPrefix));
        this.executor = pool;
        log.info("Worker pool started: workers={}", work.size());

        try {
            List<Future<T>> futures = new ArrayList<>(work.size());
            for (int i = 0; i < work.size(); i++) {
                futures.add(pool.submit(factory.create(i, work.get(i))));
            }

            List<T> results = new ArrayList<>(work.size());
            Throwable firstFailure = null;
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("Worker failed: worker={}, range={}, error={}",
                            i, work.get(i), e.getCause().getMessage(), e.getCause());
                    if (firstFailure == null) {
                        firstFailure = e.getCause();
                    }
                }
            }

            if (firstFailure != null) {
                if (firstFailure instanceof BatchExecutionException batchFailure) {
                    throw batchFailure;
                }
                throw new BatchExecutionException("Batch worker failed: " + firstFailure.getMessage(), firstFailure);
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            throw new BatchExecutionException("Interrupted while waiting for batch workers", e);
        } finally {
            shutdown(pool);
            this.executor = null;
        }
    }

    private void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            while (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Waiting for batch workers to terminate");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    /**
     * Interrupts workers of a run still in progress.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            ExecutorService running = executor;
            if (running != null) {
                running.shutdownNow();
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }
}
