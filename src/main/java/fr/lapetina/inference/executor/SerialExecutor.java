package fr.lapetina.inference.executor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.inference.executor.event.TaskEvent;
import fr.lapetina.inference.executor.event.TaskEventFactory;
import fr.lapetina.inference.executor.exception.RejectedTaskException;
import fr.lapetina.inference.executor.exception.RejectedTaskException.RejectionReason;
import fr.lapetina.inference.executor.handler.TaskHandler;
import fr.lapetina.inference.infrastructure.config.RunnerConfig;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single-consumer FIFO task executor backed by an LMAX Disruptor ring buffer.
 *
 * Any number of threads may submit; exactly one dedicated thread runs the
 * tasks, one at a time, in the order their ring buffer slots were claimed.
 * This is what makes it safe to put in front of a backend that is not
 * thread-safe: every mutating operation wrapped as a task is linearized.
 *
 * PRODUCER TYPE: MULTI, because device callers and batch workers submit from
 * their own threads.
 *
 * SHUTDOWN: {@link #stop(boolean)} flips the executor to stopping under the
 * write side of a read/write lock. Submitters publish under the read side, so
 * once the flip is done no accepted task is still being published, and the
 * drain that follows sees the complete backlog.
 *
 * WAIT STRATEGY: configurable, default {@code blocking}. Device queues are
 * idle most of the time and a pool may hold one executor per worker thread.
 */
public final class SerialExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SerialExecutor.class);

    private static final long START_TIMEOUT_SECONDS = 10;

    private enum State {
        CREATED,
        RUNNING,
        STOPPING,
        TERMINATED
    }

    private final String name;
    private final Disruptor<TaskEvent> disruptor;
    private final RingBuffer<TaskEvent> ringBuffer;
    private final TaskHandler taskHandler;
    private final WorkerThreadFactory threadFactory;
    private final MetricsRegistry metricsRegistry;
    private final long shutdownTimeoutMs;

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);
    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private SerialExecutor(Builder builder) {
        this.name = builder.name;
        this.metricsRegistry = builder.metricsRegistry;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
        this.threadFactory = new WorkerThreadFactory(builder.name);

        this.disruptor = new Disruptor<>(
                new TaskEventFactory(),
                builder.ringBufferSize,
                threadFactory,
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        this.ringBuffer = disruptor.getRingBuffer();
        this.taskHandler = new TaskHandler(builder.name, builder.metricsRegistry, ringBuffer);
        disruptor.handleEventsWith(taskHandler);
        disruptor.setDefaultExceptionHandler(new TaskExceptionHandler(builder.name));

        metricsRegistry.updateQueueRemaining(name, ringBuffer.getBufferSize());

        log.debug("SerialExecutor created: executor={}, ringBufferSize={}, waitStrategy={}",
                name, builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the worker thread and waits until it consumes the ring buffer.
     * Calling it again has no effect.
     *
     * <p>The Disruptor only counts the backlog of consumers that are running,
     * so no drain may begin before the worker is up.
     *
     * @throws IllegalStateException if the worker does not come up
     */
    public SerialExecutor start() {
        if (state.compareAndSet(State.CREATED, State.RUNNING)) {
            disruptor.start();
            boolean running;
            try {
                running = taskHandler.awaitStart(START_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                halt();
                throw new IllegalStateException("Interrupted while starting executor: " + name, e);
            }
            if (!running) {
                halt();
                throw new IllegalStateException("Executor worker did not start within "
                        + START_TIMEOUT_SECONDS + "s: " + name);
            }
            log.debug("SerialExecutor started: executor={}", name);
        }
        return this;
    }

    /**
     * Enqueues a task. Never waits for the task, nor for queue space.
     *
     * @param task the task to run on the worker thread
     * @throws RejectedTaskException if shutdown has begun or the queue is full;
     *                               the task will never run
     * @throws IllegalStateException if the executor was never started
     */
    public void submit(Task task) {
        Objects.requireNonNull(task, "Task is required");

        Lock readLock = stateLock.readLock();
        readLock.lock();
        try {
            State current = state.get();
            if (current == State.CREATED) {
                throw new IllegalStateException("Executor not started: " + name);
            }
            if (current != State.RUNNING) {
                metricsRegistry.incrementTasksRejected(name, RejectionReason.SHUTDOWN.name());
                throw new RejectedTaskException(RejectionReason.SHUTDOWN, "executor=" + name);
            }

            long sequence;
            try {
                sequence = ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                metricsRegistry.incrementTasksRejected(name, RejectionReason.QUEUE_FULL.name());
                throw new RejectedTaskException(RejectionReason.QUEUE_FULL,
                        "executor=" + name + ", capacity=" + ringBuffer.getBufferSize());
            }

            try {
                ringBuffer.get(sequence).initialize(task, sequence);
            } finally {
                ringBuffer.publish(sequence);
            }

            metricsRegistry.incrementTasksSubmitted(name);
            metricsRegistry.updateQueueRemaining(name, ringBuffer.remainingCapacity());
            log.trace("Task submitted: executor={}, sequence={}", name, sequence);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Initiates shutdown. New submissions are rejected from this point on.
     *
     * @param block if true, returns only once every task accepted before this
     *              call has run and the worker has stopped; if false, the
     *              queue drains in the background and the call returns at once
     */
    public void stop(boolean block) {
        boolean initiated = false;

        Lock writeLock = stateLock.writeLock();
        writeLock.lock();
        try {
            State current = state.get();
            if (current == State.CREATED) {
                state.set(State.TERMINATED);
                terminated.complete(null);
                log.debug("SerialExecutor stopped before start: executor={}", name);
                return;
            }
            if (current == State.RUNNING) {
                state.set(State.STOPPING);
                initiated = true;
            }
        } finally {
            writeLock.unlock();
        }

        boolean onWorkerThread = isWorkerThread();
        if (block && onWorkerThread) {
            log.warn("Blocking stop requested from the executor's own thread, draining asynchronously: executor={}",
                    name);
        }

        if (initiated) {
            log.debug("Stopping SerialExecutor: executor={}, block={}, pending={}",
                    name, block, getPendingTaskCount());
            if (block && !onWorkerThread) {
                drain();
            } else {
                Thread drainer = new Thread(this::drain, name + "-shutdown");
                drainer.start();
            }
        } else if (block && !onWorkerThread) {
            // Another caller is already draining
            terminated.join();
        }
    }

    private void drain() {
        try {
            if (shutdownTimeoutMs > 0) {
                try {
                    disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.warn("SerialExecutor drain timed out, halting: executor={}, timeoutMs={}, dropped={}",
                            name, shutdownTimeoutMs, getPendingTaskCount());
                    disruptor.halt();
                }
            } else {
                disruptor.shutdown();
            }
            log.debug("SerialExecutor stopped: executor={}, completedTasks={}, failedTasks={}",
                    name, taskHandler.getCompletedTasks(), taskHandler.getFailedTasks());
        } finally {
            state.set(State.TERMINATED);
            terminated.complete(null);
        }
    }

    /**
     * Stops the worker without draining. Queued tasks are dropped, and the
     * task currently running, if any, is interrupted. Returns at once; the
     * executor terminates when that task returns.
     */
    public void halt() {
        Lock writeLock = stateLock.writeLock();
        writeLock.lock();
        try {
            State current = state.get();
            if (current == State.TERMINATED) {
                return;
            }
            if (current == State.CREATED) {
                state.set(State.TERMINATED);
                terminated.complete(null);
                return;
            }
            state.set(State.STOPPING);
        } finally {
            writeLock.unlock();
        }

        log.warn("Halting SerialExecutor: executor={}, dropped={}", name, getPendingTaskCount());
        taskHandler.halt();
        disruptor.halt();

        Thread worker = threadFactory.workerThread;
        if (worker != null && worker != Thread.currentThread()) {
            worker.interrupt();
        }
        taskHandler.getExited().thenRun(() -> {
            state.set(State.TERMINATED);
            terminated.complete(null);
        });
    }

    /**
     * Completes once the worker has stopped, after a drain or a halt.
     */
    public CompletableFuture<Void> getTermination() {
        return terminated.copy();
    }

    /**
     * Same as {@code stop(true)}.
     */
    @Override
    public void close() {
        stop(true);
    }

    /**
     * Returns true once shutdown has been requested.
     */
    public boolean isShutdown() {
        State current = state.get();
        return current == State.STOPPING || current == State.TERMINATED;
    }

    /**
     * Returns true once the queue has drained and the worker has stopped.
     */
    public boolean isTerminated() {
        return state.get() == State.TERMINATED;
    }

    /**
     * Returns true when called from this executor's worker thread.
     */
    public boolean isWorkerThread() {
        return Thread.currentThread() == threadFactory.workerThread;
    }

    public String getName() {
        return name;
    }

    /**
     * Number of tasks that have run, including the ones that threw.
     */
    public long getCompletedTaskCount() {
        return taskHandler.getCompletedTasks();
    }

    public long getFailedTaskCount() {
        return taskHandler.getFailedTasks();
    }

    public long getPendingTaskCount() {
        return ringBuffer.getBufferSize() - ringBuffer.remainingCapacity();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    private WaitStrategy createWaitStrategy(String strategyName) {
        return switch (strategyName.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", strategyName);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for the single consumer thread. Remembers the thread so
     * the executor can recognise calls made from its own tasks.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final String executorName;
        private volatile Thread workerThread;

        WorkerThreadFactory(String executorName) {
            this.executorName = executorName;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, executorName + "-worker");
            t.setDaemon(false);
            workerThread = t;
            return t;
        }
    }

    /**
     * Last line of defence: TaskHandler catches exceptions, this catches
     * errors so the worker thread keeps consuming.
     */
    private static class TaskExceptionHandler
            implements com.lmax.disruptor.ExceptionHandler<TaskEvent> {

        private final String executorName;

        TaskExceptionHandler(String executorName) {
            this.executorName = executorName;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, TaskEvent event) {
            log.error("Unhandled error in task: executor={}, sequence={}, event={}",
                    executorName, sequence, event, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during executor start: executor={}", executorName, ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during executor shutdown: executor={}", executorName, ex);
        }
    }

    /**
     * Builder for SerialExecutor.
     */
    public static final class Builder {
        private String name = "serial-executor";
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 0;
        private MetricsRegistry metricsRegistry;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        /**
         * Zero waits for the drain indefinitely. A positive value halts the
         * worker after the timeout, dropping whatever is still queued.
         */
        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(RunnerConfig.ExecutorConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            this.shutdownTimeoutMs = config.getShutdownTimeoutMs();
            return this;
        }

        public SerialExecutor build() {
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Executor name is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new SerialExecutor(this);
        }
    }
}
