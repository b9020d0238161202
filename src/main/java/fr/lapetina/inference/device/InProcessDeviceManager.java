package fr.lapetina.inference.device;

import fr.lapetina.inference.domain.model.DeviceErrorType;
import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.Module;
import fr.lapetina.inference.domain.model.Tensor;
import fr.lapetina.inference.domain.model.TensorType;
import fr.lapetina.inference.executor.SerialExecutor;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Device that runs compiled functions on its own queue thread, in process.
 * Registered as the {@code cpu} device kind.
 */
public class InProcessDeviceManager extends QueueBackedDeviceManager {

    private static final Logger log = LoggerFactory.getLogger(InProcessDeviceManager.class);

    private final NetworkRegistry networks;

    public InProcessDeviceManager(
            String name,
            int maxNetworks,
            SerialExecutor executor,
            MetricsRegistry metricsRegistry
    ) {
        // The registry validates the capacity before the executor is started
        this(name, new NetworkRegistry(maxNetworks), executor, metricsRegistry);
    }

    private InProcessDeviceManager(
            String name,
            NetworkRegistry networks,
            SerialExecutor executor,
            MetricsRegistry metricsRegistry
    ) {
        super(name, executor, metricsRegistry);
        this.networks = networks;
    }

    @Override
    protected void addNetworkImpl(Module module, Map<String, CompiledFunction> functions) throws DeviceException {
        networks.addAll(functions);
        log.debug("Module loaded: device={}, module={}, loaded={}/{}",
                getName(), module.name(), networks.size(), networks.getCapacity());
    }

    @Override
    protected void evictNetworkImpl(String functionName) throws DeviceException {
        networks.remove(functionName);
    }

    @Override
    protected void runFunctionImpl(String functionName, ExecutionContext context) throws DeviceException {
        CompiledFunction function = networks.require(functionName);

        for (Map.Entry<String, TensorType> input : function.getInputTypes().entrySet()) {
            Optional<Tensor> bound = context.get(input.getKey());
            if (bound.isEmpty()) {
                throw new DeviceException(DeviceErrorType.SHAPE_MISMATCH,
                        "Input not bound: " + input.getKey());
            }
            if (!bound.get().getType().equals(input.getValue())) {
                throw new DeviceException(DeviceErrorType.SHAPE_MISMATCH,
                        "Input " + input.getKey() + " has type " + bound.get().getType()
                                + ", expected " + input.getValue());
            }
        }

        try {
            function.execute(context);
        } catch (DeviceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DeviceException(DeviceErrorType.EXECUTION_FAILED,
                    "Function " + functionName + " failed: " + e.getMessage(), e);
        }
    }
}
