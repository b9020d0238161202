package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.DeviceErrorType;
import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.Module;
import fr.lapetina.inference.domain.model.NetworkResult;
import fr.lapetina.inference.domain.model.RunIdentifier;
import fr.lapetina.inference.domain.model.RunResult;
import fr.lapetina.inference.executor.SerialExecutor;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for devices whose backend is not thread-safe.
 *
 * Every backend operation is wrapped as a task on one {@link SerialExecutor},
 * so subclasses implement the {@code *Impl} methods as plain single-threaded
 * code: they are never called concurrently, and always from the executor
 * thread.
 */
public abstract class QueueBackedDeviceManager implements DeviceManager {

    private static final Logger log = LoggerFactory.getLogger(QueueBackedDeviceManager.class);

    private final String name;
    private final SerialExecutor executor;
    private final MetricsRegistry metricsRegistry;
    private final AtomicLong nextRunId = new AtomicLong();

    protected QueueBackedDeviceManager(String name, SerialExecutor executor, MetricsRegistry metricsRegistry) {
        this.name = Objects.requireNonNull(name, "Device name is required");
        this.executor = Objects.requireNonNull(executor, "Executor is required");
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "MetricsRegistry is required");
        executor.start();
    }

    /**
     * Loads the functions. Must leave the device unchanged when it throws.
     */
    protected abstract void addNetworkImpl(Module module, Map<String, CompiledFunction> functions)
            throws DeviceException;

    protected abstract void evictNetworkImpl(String functionName) throws DeviceException;

    /**
     * Runs a loaded function against the context.
     */
    protected abstract void runFunctionImpl(String functionName, ExecutionContext context)
            throws DeviceException;

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void addNetwork(Module module, Map<String, CompiledFunction> functions, ReadyCallback onReady) {
        Objects.requireNonNull(module, "Module is required");
        Objects.requireNonNull(onReady, "Ready callback is required");
        Map<String, CompiledFunction> snapshot = Map.copyOf(functions);

        executor.submit(() -> {
            NetworkResult result;
            try {
                addNetworkImpl(module, snapshot);
                result = NetworkResult.success(module.name(), snapshot.keySet());
                log.info("Network added: device={}, module={}, functions={}",
                        name, module.name(), snapshot.keySet());
            } catch (DeviceException e) {
                result = NetworkResult.error(module.name(), snapshot.keySet(), e.getErrorType(), e.getMessage());
                log.warn("Network add failed: device={}, module={}, errorType={}, error={}",
                        name, module.name(), e.getErrorType(), e.getMessage());
            } catch (RuntimeException e) {
                result = NetworkResult.error(module.name(), snapshot.keySet(),
                        DeviceErrorType.INTERNAL_ERROR, e.toString());
                log.error("Unexpected error adding network: device={}, module={}", name, module.name(), e);
            }
            deliver(onReady, result);
        });
    }

    @Override
    public void evictNetwork(String functionName) {
        Objects.requireNonNull(functionName, "Function name is required");

        executor.submit(() -> {
            try {
                evictNetworkImpl(functionName);
                log.info("Network evicted: device={}, function={}", name, functionName);
            } catch (DeviceException e) {
                log.warn("Network evict failed: device={}, function={}, errorType={}, error={}",
                        name, functionName, e.getErrorType(), e.getMessage());
            }
        });
    }

    @Override
    public RunIdentifier runFunction(String functionName, ExecutionContext context, ResultCallback onDone) {
        Objects.requireNonNull(functionName, "Function name is required");
        Objects.requireNonNull(context, "Execution context is required");
        Objects.requireNonNull(onDone, "Result callback is required");

        RunIdentifier runId = new RunIdentifier(nextRunId.getAndIncrement());

        executor.submit(() -> {
            Instant startedAt = Instant.now();
            RunResult result;
            try {
                runFunctionImpl(functionName, context);
                Duration elapsed = Duration.between(startedAt, Instant.now());
                result = RunResult.success(runId, functionName, context, elapsed);
                metricsRegistry.recordRunLatency(name, elapsed);
            } catch (DeviceException e) {
                result = RunResult.error(runId, functionName, context, e.getErrorType(), e.getMessage());
                log.debug("Run failed: device={}, runId={}, function={}, errorType={}, error={}",
                        name, runId, functionName, e.getErrorType(), e.getMessage());
            } catch (RuntimeException e) {
                result = RunResult.error(runId, functionName, context,
                        DeviceErrorType.INTERNAL_ERROR, e.toString());
                log.error("Unexpected error running function: device={}, runId={}, function={}",
                        name, runId, functionName, e);
            }
            metricsRegistry.incrementRunCount(name,
                    result.isSuccess() ? "success" : result.errorType().name().toLowerCase());
            deliver(onDone, result);
        });

        log.trace("Run submitted: device={}, runId={}, function={}", name, runId, functionName);
        return runId;
    }

    private void deliver(ReadyCallback callback, NetworkResult result) {
        try {
            callback.onReady(result);
        } catch (RuntimeException e) {
            log.error("Ready callback threw: device={}, module={}", name, result.moduleName(), e);
        }
    }

    private void deliver(ResultCallback callback, RunResult result) {
        try {
            callback.onResult(result);
        } catch (RuntimeException e) {
            log.error("Result callback threw: device={}, runId={}", name, result.runId(), e);
        }
    }

    @Override
    public void stop(boolean block) {
        log.debug("Stopping device: device={}, block={}", name, block);
        executor.stop(block);
    }

    @Override
    public void halt() {
        log.warn("Halting device: device={}", name);
        executor.halt();
    }

    /**
     * Returns true when called from this device's queue thread.
     */
    protected boolean isDeviceThread() {
        return executor.isWorkerThread();
    }

    protected SerialExecutor getExecutor() {
        return executor;
    }

    protected MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name='" + name + "'}";
    }
}
