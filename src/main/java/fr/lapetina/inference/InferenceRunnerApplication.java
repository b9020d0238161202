package fr.lapetina.inference;

import fr.lapetina.inference.batch.BatchConfigurationException;
import fr.lapetina.inference.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.infrastructure.config.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Main entry point for the image classification runner.
 *
 * <p>Arguments: the configuration file, then the input files. A single
 * {@code -} reads input file names from standard input instead.
 * The exit status is the number of mismatched or failed inputs; configuration
 * errors exit with 1.
 */
public class InferenceRunnerApplication {

    private static final Logger log = LoggerFactory.getLogger(InferenceRunnerApplication.class);

    static final String STREAM_ARGUMENT = "-";

    private InferenceRunnerApplication() {
    }

    /**
     * Runs a classification and returns the exit status.
     */
    static int run(String[] args, PrintStream out, InputStream in) {
        String configPath = args.length > 0 ? args[0] : "runner.yaml";
        List<String> positional = args.length > 1
                ? Arrays.asList(args).subList(1, args.length)
                : List.of();

        try (RunnerFactory factory = RunnerFactory.create(configPath)) {
            List<String> inputs = resolveInputs(positional, factory.getConfig().getBatch());
            if (inputs.isEmpty() && !factory.getConfig().getBatch().isStreaming()) {
                log.warn("No inputs given, nothing to classify");
            }
            return factory.createRunner(out, in).run(inputs);
        } catch (ConfigLoader.ConfigurationException | BatchConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * Works out the input list from the positional arguments and the
     * configured input list file. Switches the batch to streaming mode for a
     * lone {@code -}.
     */
    static List<String> resolveInputs(List<String> positional, RunnerConfig.BatchConfig batch) {
        if (positional.size() == 1 && STREAM_ARGUMENT.equals(positional.get(0))) {
            batch.setStreaming(true);
            return List.of();
        }

        String listFile = batch.getInputListFile();
        if (listFile == null || listFile.isBlank()) {
            return List.copyOf(positional);
        }
        if (!positional.isEmpty()) {
            throw new BatchConfigurationException(
                    "When using an input list file all inputs must be specified in " + listFile);
        }

        try {
            return Files.readAllLines(Path.of(listFile)).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .toList();
        } catch (IOException e) {
            throw new ConfigLoader.ConfigurationException("Failed to read input list file: " + listFile, e);
        }
    }

    public static void main(String[] args) {
        int status;
        try {
            status = run(args, System.out, System.in);
        } catch (Exception e) {
            log.error("Inference run failed", e);
            status = 1;
        }
        System.exit(status);
    }
}
