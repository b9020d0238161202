package fr.lapetina.inference.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Task counters per serial executor (submitted, executed, failed, rejected)
 * - Task execution and queue wait timers
 * - Device run outcome counters and latency
 * - Job mismatch counter for batch runs
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    // Gauge values, held strongly: Micrometer only keeps weak references
    private final ConcurrentHashMap<String, AtomicLong> queueRemaining = new ConcurrentHashMap<>();

    private final Counter mismatchCounter;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        this.mismatchCounter = Counter.builder(prefix + "_job_mismatches_total")
                .description("Jobs whose result did not match the expected label or failed to run")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("inference_runner");
    }

    public void incrementTasksSubmitted(String executor) {
        executorCounter("_tasks_submitted_total", "Tasks accepted by a serial executor", executor).increment();
    }

    public void incrementTasksExecuted(String executor) {
        executorCounter("_tasks_executed_total", "Tasks that ran to completion", executor).increment();
    }

    public void incrementTasksFailed(String executor) {
        executorCounter("_tasks_failed_total", "Tasks that threw while running", executor).increment();
    }

    /**
     * Increments the rejection counter for an executor and rejection reason.
     */
    public void incrementTasksRejected(String executor, String reason) {
        String key = "rejected:" + executor + ":" + reason;
        counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_tasks_rejected_total")
                        .description("Tasks refused at submission")
                        .tag("executor", executor)
                        .tag("reason", reason)
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long a task ran on its executor thread.
     */
    public void recordTaskDuration(String executor, Duration duration) {
        executorTimer("_task_duration", "Task execution time", executor).record(duration);
    }

    /**
     * Records how long a task waited in the queue before it started.
     */
    public void recordQueueWait(String executor, Duration duration) {
        executorTimer("_task_queue_wait", "Time between submission and execution", executor).record(duration);
    }

    /**
     * Increments the run counter for a device and outcome.
     */
    public void incrementRunCount(String device, String outcome) {
        String key = "runs:" + device + ":" + outcome;
        counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_runs_total")
                        .description("Function runs completed by a device")
                        .tag("device", device)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Records function run latency on a device.
     */
    public void recordRunLatency(String device, Duration latency) {
        String key = "run_latency:" + device;
        timers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_run_latency")
                        .description("Function run latency")
                        .tag("device", device)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementMismatches(int count) {
        if (count > 0) {
            mismatchCounter.increment(count);
        }
    }

    /**
     * Sets the free slot count of an executor's ring buffer. The gauge for an
     * executor name is registered on first use and reused by later executors
     * of the same name.
     */
    public void updateQueueRemaining(String executor, long remaining) {
        queueRemaining.computeIfAbsent(executor, k -> {
            AtomicLong value = new AtomicLong();
            Gauge.builder(prefix + "_queue_remaining", value, AtomicLong::get)
                    .description("Remaining capacity in an executor ring buffer")
                    .tag("executor", executor)
                    .register(registry);
            return value;
        }).set(remaining);
    }

    private Counter executorCounter(String suffix, String description, String executor) {
        return counters.computeIfAbsent(suffix + ":" + executor, k ->
                Counter.builder(prefix + suffix)
                        .description(description)
                        .tag("executor", executor)
                        .register(registry)
        );
    }

    private Timer executorTimer(String suffix, String description, String executor) {
        return timers.computeIfAbsent(suffix + ":" + executor, k ->
                Timer.builder(prefix + suffix)
                        .description(description)
                        .tag("executor", executor)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
