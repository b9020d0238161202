package fr.lapetina.inference.executor.handler;

import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.LifecycleAware;
import com.lmax.disruptor.RingBuffer;
import fr.lapetina.inference.executor.Task;
import fr.lapetina.inference.executor.event.TaskEvent;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sole consumer of a serial executor's ring buffer: runs each task in
 * sequence order.
 *
 * Responsibilities:
 * - Runs the task carried by the slot
 * - Catches task failures so the queue keeps draining
 * - Records queue wait and execution time
 * - Clears the slot so the task cannot run twice
 * - Publishes the ring buffer's free capacity after each task
 * - Signals when the consumer thread has started and when it has exited
 * - Once halted, drops the tasks left in the batch it is processing
 */
public final class TaskHandler implements EventHandler<TaskEvent>, LifecycleAware {

    private static final Logger log = LoggerFactory.getLogger(TaskHandler.class);

    private final String executorName;
    private final MetricsRegistry metricsRegistry;
    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();
    private final RingBuffer<TaskEvent> ringBuffer;
    private final CountDownLatch started = new CountDownLatch(1);
    private final CompletableFuture<Void> exited = new CompletableFuture<>();
    private final AtomicBoolean halted = new AtomicBoolean(false);

    public TaskHandler(String executorName, MetricsRegistry metricsRegistry, RingBuffer<TaskEvent> ringBuffer) {
        this.executorName = executorName;
        this.metricsRegistry = metricsRegistry;
        this.ringBuffer = ringBuffer;
    }

    @Override
    public void onStart() {
        log.debug("Consumer started: executor={}, thread={}", executorName, Thread.currentThread().getName());
        started.countDown();
    }

    @Override
    public void onShutdown() {
        log.debug("Consumer exited: executor={}, completedTasks={}", executorName, completedTasks.get());
        exited.complete(null);
    }

    /**
     * Waits until the consumer thread is running and reading the ring buffer.
     *
     * @return false if it did not start within the timeout
     */
    public boolean awaitStart(long timeout, TimeUnit unit) throws InterruptedException {
        return started.await(timeout, unit);
    }

    /**
     * Marks the handler halted: tasks it has not started yet are skipped.
     * The Disruptor only checks for a halt between batches.
     */
    public void halt() {
        halted.set(true);
    }

    /**
     * Completes once the consumer thread has left its event loop.
     */
    public CompletableFuture<Void> getExited() {
        return exited;
    }

    @Override
    public void onEvent(TaskEvent event, long sequence, boolean endOfBatch) {
        Task task = event.getTask();
        if (task == null) {
            log.debug("Skipping empty slot: executor={}, sequence={}", executorName, sequence);
            return;
        }
        if (halted.get()) {
            event.clear();
            log.debug("Dropping task after halt: executor={}, sequence={}", executorName, sequence);
            return;
        }

        Instant startedAt = Instant.now();
        if (event.getEnqueuedAt() != null) {
            metricsRegistry.recordQueueWait(executorName, Duration.between(event.getEnqueuedAt(), startedAt));
        }

        try {
            task.execute();
            metricsRegistry.incrementTasksExecuted(executorName);
        } catch (Exception e) {
            // Task-level errors belong to the task; the queue keeps going.
            failedTasks.incrementAndGet();
            metricsRegistry.incrementTasksFailed(executorName);
            log.error("Task failed: executor={}, sequence={}, error={}",
                    executorName, sequence, e.getMessage(), e);
        } finally {
            event.clear();
            completedTasks.incrementAndGet();
            metricsRegistry.recordTaskDuration(executorName, Duration.between(startedAt, Instant.now()));
            metricsRegistry.updateQueueRemaining(executorName, ringBuffer.remainingCapacity());
        }

        log.trace("Task finished: executor={}, sequence={}", executorName, sequence);
    }

    /**
     * Number of tasks that have run, successfully or not.
     */
    public long getCompletedTasks() {
        return completedTasks.get();
    }

    public long getFailedTasks() {
        return failedTasks.get();
    }
}
