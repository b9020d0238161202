package fr.lapetina.inference.device;

import fr.lapetina.inference.executor.SerialExecutor;
import fr.lapetina.inference.infrastructure.config.RunnerConfig;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates device managers by kind name.
 *
 * Each device gets its own serial executor, named after the device.
 */
public final class DeviceFactory {

    /**
     * Builds a device of one kind around an executor the factory created for it.
     */
    @FunctionalInterface
    public interface DeviceProvider {
        DeviceManager create(
                String name,
                RunnerConfig.DeviceConfig config,
                SerialExecutor executor,
                MetricsRegistry metricsRegistry
        );
    }

    private static final Map<String, DeviceProvider> REGISTRY = new ConcurrentHashMap<>();

    static {
        // Register built-in devices
        register("cpu", (name, config, executor, metrics) ->
                new InProcessDeviceManager(name, config.getMaxNetworks(), executor, metrics));
    }

    private DeviceFactory() {
        // Utility class
    }

    /**
     * Registers a custom device kind.
     *
     * @param kind Device kind (used in configuration)
     * @param provider Factory for creating device instances
     */
    public static void register(String kind, DeviceProvider provider) {
        REGISTRY.put(kind.toLowerCase(), provider);
    }

    /**
     * Creates a device of the configured kind.
     *
     * @param name Device name, also used for its executor thread
     * @param config Runner configuration (device and executor sections)
     * @param metricsRegistry Metrics sink
     * @return A started device
     * @throws IllegalArgumentException if the kind is not registered
     */
    public static DeviceManager create(String name, RunnerConfig config, MetricsRegistry metricsRegistry) {
        String kind = config.getDevice().getKind();
        DeviceProvider provider = REGISTRY.get(kind.toLowerCase());
        if (provider == null) {
            throw new IllegalArgumentException("Unknown device kind: " + kind + ", known: " + REGISTRY.keySet());
        }

        SerialExecutor executor = SerialExecutor.builder()
                .name(name)
                .fromConfig(config.getExecutor())
                .metricsRegistry(metricsRegistry)
                .build();
        try {
            return provider.create(name, config.getDevice(), executor, metricsRegistry);
        } catch (RuntimeException e) {
            // The provider may have started the executor before failing
            executor.stop(true);
            throw e;
        }
    }

    public static boolean isRegistered(String kind) {
        return REGISTRY.containsKey(kind.toLowerCase());
    }

    /**
     * Returns all registered device kinds.
     */
    public static Iterable<String> getRegisteredKinds() {
        return REGISTRY.keySet();
    }
}
