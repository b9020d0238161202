package fr.lapetina.inference;

import fr.lapetina.inference.batch.BatchRunner;
import fr.lapetina.inference.compiler.DenseModelCompiler;
import fr.lapetina.inference.compiler.ModelCompiler;
import fr.lapetina.inference.device.DeviceFactory;
import fr.lapetina.inference.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.infrastructure.config.RunnerConfig;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.preprocess.ImagePreprocessor;
import fr.lapetina.inference.preprocess.PreprocessingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Wires a batch runner from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RunnerFactory factory = RunnerFactory.create("runner.yaml")) {
 *     int mismatches = factory.createRunner(System.out, System.in).run(files);
 * }
 * }</pre>
 */
public class RunnerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunnerFactory.class);

    private final RunnerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final PreprocessingConfig preprocessingConfig;
    private final ModelCompiler compiler;

    protected RunnerFactory(RunnerConfig config) {
        this.config = config;

        if (config.getModel().getPath() == null || config.getModel().getPath().isBlank()) {
            throw new ConfigLoader.ConfigurationException("model.path is required");
        }
        if (!DeviceFactory.isRegistered(config.getDevice().getKind())) {
            throw new ConfigLoader.ConfigurationException("Unknown device kind: " + config.getDevice().getKind());
        }
        if (config.getDevice().getMaxNetworks() < 1) {
            throw new ConfigLoader.ConfigurationException(
                    "device.maxNetworks must be at least 1: " + config.getDevice().getMaxNetworks());
        }

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        try {
            this.preprocessingConfig = PreprocessingConfig.fromSettings(config.getPreprocessing());
        } catch (IllegalArgumentException e) {
            metricsRegistry.close();
            throw new ConfigLoader.ConfigurationException("Invalid preprocessing settings: " + e.getMessage(), e);
        }

        this.compiler = new DenseModelCompiler(Path.of(config.getModel().getPath()), config.getModel().getInputName());

        log.info("RunnerFactory initialized: model={}, device={}, threads={}, miniBatch={}",
                config.getModel().getPath(), config.getDevice().getKind(),
                config.getBatch().getThreads(), config.getBatch().getMiniBatch());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static RunnerFactory create(String configPath) {
        return new RunnerFactory(new ConfigLoader(configPath).load());
    }

    public static RunnerFactory create(RunnerConfig config) {
        return new RunnerFactory(config);
    }

    public BatchRunner createRunner(PrintStream out, InputStream in) {
        return BatchRunner.builder()
                .config(config)
                .preprocessor(new ImagePreprocessor(preprocessingConfig))
                .compiler(compiler)
                .metricsRegistry(metricsRegistry)
                .out(out)
                .in(in)
                .build();
    }

    public RunnerConfig getConfig() {
        return config;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public PreprocessingConfig getPreprocessingConfig() {
        return preprocessingConfig;
    }

    @Override
    public void close() {
        if (config.getMetrics().isEnabled() && log.isDebugEnabled()) {
            log.debug("Final metrics:\n{}", metricsRegistry.scrape());
        }
        metricsRegistry.close();
    }
}
