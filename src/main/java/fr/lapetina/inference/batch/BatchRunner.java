package fr.lapetina.inference.batch;

import fr.lapetina.inference.compiler.ModelCompiler;
import fr.lapetina.inference.device.DeviceFactory;
import fr.lapetina.inference.device.DeviceManager;
import fr.lapetina.inference.domain.model.BatchRange;
import fr.lapetina.inference.infrastructure.config.RunnerConfig;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.preprocess.InputPreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Function;

/**
 * Drives a batch classification run: validates the options, partitions the
 * jobs, runs one worker per range and returns the mismatch count.
 *
 * Every configuration error is raised before a thread is started.
 */
public final class BatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    static final String PARALLEL_WARNING = "WARNING: multi-threaded execution is not possible. "
            + "Make sure that you are not trying to dump profile or emit bundle.";

    private final RunnerConfig.BatchConfig config;
    private final String networkName;
    private final InputPreprocessor preprocessor;
    private final ModelCompiler compiler;
    private final Function<String, DeviceManager> deviceProvider;
    private final PrintStream out;
    private final InputStream in;
    private final MetricsRegistry metricsRegistry;

    private BatchRunner(Builder builder) {
        this.config = builder.config.getBatch();
        this.networkName = builder.config.getModel().getNetworkName();
        this.preprocessor = builder.preprocessor;
        this.compiler = builder.compiler;
        this.metricsRegistry = builder.metricsRegistry;
        this.deviceProvider = builder.deviceProvider != null
                ? builder.deviceProvider
                : name -> DeviceFactory.create(name, builder.config, builder.metricsRegistry);
        this.out = builder.out;
        this.in = builder.in;
    }

    /**
     * Classifies the given inputs, or reads them from the input stream in
     * streaming mode.
     *
     * @param jobs input files; must be empty in streaming mode
     * @return number of mismatched or failed jobs
     * @throws BatchConfigurationException if the options are inconsistent
     * @throws BatchExecutionException     if a worker could not complete
     */
    public int run(List<String> jobs) {
        validate(jobs.size());

        ResultAggregator aggregator = new ResultAggregator(out, metricsRegistry);
        ClassificationReporter reporter = new ClassificationReporter(
                config.getTopK(), config.isComputeSoftmax(), config.getLabelOffset(), config.getExpectedLabels());
        WorkerEnvironment env = new WorkerEnvironment(
                preprocessor, compiler, deviceProvider, reporter, aggregator, config, networkName);

        aggregator.print("Model: " + compiler.getModelDescription());

        List<BatchRange> ranges;
        WorkerPool.WorkerFactory<WorkerResult> factory;
        if (config.isStreaming()) {
            // One worker, no fixed range
            ranges = List.of(new BatchRange(0, 1));
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            factory = (id, range) -> new BatchWorker(id, new StreamBatchSource(reader, out), env);
        } else {
            boolean parallelAllowed = config.isParallelAllowed();
            if (config.getThreads() > 1 && !parallelAllowed) {
                aggregator.print(PARALLEL_WARNING);
                log.warn("Parallel execution disabled: profiling={}, emitBundle={}, requestedThreads={}",
                        config.isProfiling(), config.isEmitBundle(), config.getThreads());
            }
            int unitSize = config.getMiniBatch() > 0 ? config.getMiniBatch() : 1;
            ranges = BatchPartitioner.partition(jobs.size(), unitSize, config.getThreads(), parallelAllowed);
            factory = (id, range) -> new BatchWorker(id,
                    new RangeBatchSource(jobs, range, config.getMiniBatch()), env);
        }

        // Trailing ranges can be empty; they get no thread
        long workers = ranges.stream().filter(range -> !range.isEmpty()).count();
        aggregator.print("Running " + workers + " thread(s).");
        log.info("Batch run starting: jobs={}, ranges={}, miniBatch={}, streaming={}",
                jobs.size(), ranges, config.getMiniBatch(), config.isStreaming());

        List<WorkerResult> results;
        try (WorkerPool pool = new WorkerPool()) {
            results = pool.run(ranges, factory);
        }

        int mismatches = aggregator.getMismatchCount();
        log.info("Batch run finished: workers={}, reports={}, mismatches={}",
                results.size(), aggregator.getReportCount(), mismatches);
        return mismatches;
    }

    /**
     * Rejects option combinations that cannot run.
     */
    void validate(int jobCount) {
        if (config.getThreads() < 1) {
            throw new BatchConfigurationException("Thread count must be at least 1: " + config.getThreads());
        }
        if (config.getMiniBatch() < 0) {
            throw new BatchConfigurationException("Mini-batch size must not be negative: " + config.getMiniBatch());
        }
        if (config.getTopK() < 1) {
            throw new BatchConfigurationException("topK must be at least 1: " + config.getTopK());
        }

        if (config.isStreaming()) {
            if (config.getThreads() > 1) {
                throw new BatchConfigurationException("Streaming mode runs on a single thread, "
                        + config.getThreads() + " requested");
            }
            if (config.getMiniBatch() > 0) {
                throw new BatchConfigurationException("Mini-batch mode is not compatible with streaming mode");
            }
            if (config.isEmitBundle()) {
                throw new BatchConfigurationException("Cannot emit a bundle and also stream inputs");
            }
            if (jobCount > 0) {
                throw new BatchConfigurationException("Streaming mode reads its inputs from standard input");
            }
            if (!config.getExpectedLabels().isEmpty()) {
                throw new BatchConfigurationException("Expected labels cannot be used in streaming mode");
            }
            return;
        }

        if (config.getMiniBatch() > 0 && jobCount % config.getMiniBatch() != 0) {
            throw new BatchConfigurationException("The number of inputs (" + jobCount
                    + ") must be a multiple of the mini-batch (" + config.getMiniBatch() + ")");
        }
        if (!config.getExpectedLabels().isEmpty() && config.getExpectedLabels().size() != jobCount) {
            throw new BatchConfigurationException("Number of expected labels: " + config.getExpectedLabels().size()
                    + " doesn't match the number of files: " + jobCount);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for BatchRunner.
     */
    public static final class Builder {
        private RunnerConfig config;
        private InputPreprocessor preprocessor;
        private ModelCompiler compiler;
        private Function<String, DeviceManager> deviceProvider;
        private PrintStream out = System.out;
        private InputStream in = System.in;
        private MetricsRegistry metricsRegistry;

        public Builder config(RunnerConfig config) {
            this.config = config;
            return this;
        }

        public Builder preprocessor(InputPreprocessor preprocessor) {
            this.preprocessor = preprocessor;
            return this;
        }

        public Builder compiler(ModelCompiler compiler) {
            this.compiler = compiler;
            return this;
        }

        /**
         * Overrides device creation; by default devices come from
         * {@link DeviceFactory} using the configured device kind.
         */
        public Builder deviceProvider(Function<String, DeviceManager> deviceProvider) {
            this.deviceProvider = deviceProvider;
            return this;
        }

        public Builder out(PrintStream out) {
            this.out = out;
            return this;
        }

        public Builder in(InputStream in) {
            this.in = in;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public BatchRunner build() {
            if (config == null) {
                throw new IllegalStateException("Config is required");
            }
            if (preprocessor == null) {
                throw new IllegalStateException("InputPreprocessor is required");
            }
            if (compiler == null) {
                throw new IllegalStateException("ModelCompiler is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new BatchRunner(this);
        }
    }
}
