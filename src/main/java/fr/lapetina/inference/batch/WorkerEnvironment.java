package fr.lapetina.inference.batch;

import fr.lapetina.inference.compiler.ModelCompiler;
import fr.lapetina.inference.device.DeviceManager;
import fr.lapetina.inference.infrastructure.config.RunnerConfig;
import fr.lapetina.inference.preprocess.InputPreprocessor;

import java.util.Objects;
import java.util.function.Function;

/**
 * Collaborators every batch worker of a run uses. All of them are either
 * stateless or thread-safe; per-worker state (device, compiled model, profile)
 * is created by the worker itself.
 *
 * @param deviceProvider creates a started device with the given name
 */
public record WorkerEnvironment(
        InputPreprocessor preprocessor,
        ModelCompiler compiler,
        Function<String, DeviceManager> deviceProvider,
        ClassificationReporter reporter,
        ResultAggregator aggregator,
        RunnerConfig.BatchConfig batchConfig,
        String networkName
) {
    public WorkerEnvironment {
        Objects.requireNonNull(preprocessor, "Preprocessor is required");
        Objects.requireNonNull(compiler, "Compiler is required");
        Objects.requireNonNull(deviceProvider, "Device provider is required");
        Objects.requireNonNull(reporter, "Reporter is required");
        Objects.requireNonNull(aggregator, "Aggregator is required");
        Objects.requireNonNull(batchConfig, "Batch config is required");
        Objects.requireNonNull(networkName, "Network name is required");
    }
}
