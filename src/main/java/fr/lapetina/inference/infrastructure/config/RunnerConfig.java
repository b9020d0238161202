package fr.lapetina.inference.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the inference runner.
 * Designed to be populated from YAML.
 */
public class RunnerConfig {

    private ExecutorConfig executor = new ExecutorConfig();
    private DeviceConfig device = new DeviceConfig();
    private ModelConfig model = new ModelConfig();
    private PreprocessingSettings preprocessing = new PreprocessingSettings();
    private BatchConfig batch = new BatchConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ExecutorConfig getExecutor() { return executor; }
    public void setExecutor(ExecutorConfig executor) { this.executor = executor; }

    public DeviceConfig getDevice() { return device; }
    public void setDevice(DeviceConfig device) { this.device = device; }

    public ModelConfig getModel() { return model; }
    public void setModel(ModelConfig model) { this.model = model; }

    public PreprocessingSettings getPreprocessing() { return preprocessing; }
    public void setPreprocessing(PreprocessingSettings preprocessing) { this.preprocessing = preprocessing; }

    public BatchConfig getBatch() { return batch; }
    public void setBatch(BatchConfig batch) { this.batch = batch; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Serial executor (device work queue) configuration.
     */
    public static class ExecutorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 0;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
        public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    }

    /**
     * Device manager configuration.
     */
    public static class DeviceConfig {
        private String kind = "cpu";
        private int maxNetworks = 16;

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public int getMaxNetworks() { return maxNetworks; }
        public void setMaxNetworks(int maxNetworks) { this.maxNetworks = maxNetworks; }
    }

    /**
     * Model location and naming.
     */
    public static class ModelConfig {
        private String path;
        private String inputName = "data";
        private String networkName = "classifier";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getInputName() { return inputName; }
        public void setInputName(String inputName) { this.inputName = inputName; }

        public String getNetworkName() { return networkName; }
        public void setNetworkName(String networkName) { this.networkName = networkName; }
    }

    /**
     * Raw image preprocessing settings, validated into a PreprocessingConfig.
     */
    public static class PreprocessingSettings {
        private String normalizationMode = "0to1";
        private String channelOrder = "BGR";
        private String layout = "NCHW";
        private List<Double> mean = new ArrayList<>();
        private List<Double> stddev = new ArrayList<>();
        private boolean useImagenetNormalization = false;
        private boolean convertToFloat16 = false;

        public String getNormalizationMode() { return normalizationMode; }
        public void setNormalizationMode(String normalizationMode) { this.normalizationMode = normalizationMode; }

        public String getChannelOrder() { return channelOrder; }
        public void setChannelOrder(String channelOrder) { this.channelOrder = channelOrder; }

        public String getLayout() { return layout; }
        public void setLayout(String layout) { this.layout = layout; }

        public List<Double> getMean() { return mean; }
        public void setMean(List<Double> mean) { this.mean = mean; }

        public List<Double> getStddev() { return stddev; }
        public void setStddev(List<Double> stddev) { this.stddev = stddev; }

        public boolean isUseImagenetNormalization() { return useImagenetNormalization; }
        public void setUseImagenetNormalization(boolean use) { this.useImagenetNormalization = use; }

        public boolean isConvertToFloat16() { return convertToFloat16; }
        public void setConvertToFloat16(boolean convertToFloat16) { this.convertToFloat16 = convertToFloat16; }
    }

    /**
     * Batch scheduling and result reporting configuration.
     */
    public static class BatchConfig {
        private int threads = 1;
        private int miniBatch = 0;
        private boolean streaming = false;
        private boolean profiling = false;
        private String profilePath = "profile.yaml";
        private boolean emitBundle = false;
        private String bundlePath = "bundle.json";
        private String inputListFile;
        private int topK = 1;
        private boolean computeSoftmax = false;
        private int labelOffset = 0;
        private List<Integer> expectedLabels = new ArrayList<>();
        private long runTimeoutMs = 0;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }

        public int getMiniBatch() { return miniBatch; }
        public void setMiniBatch(int miniBatch) { this.miniBatch = miniBatch; }

        public boolean isStreaming() { return streaming; }
        public void setStreaming(boolean streaming) { this.streaming = streaming; }

        public boolean isProfiling() { return profiling; }
        public void setProfiling(boolean profiling) { this.profiling = profiling; }

        public String getProfilePath() { return profilePath; }
        public void setProfilePath(String profilePath) { this.profilePath = profilePath; }

        public boolean isEmitBundle() { return emitBundle; }
        public void setEmitBundle(boolean emitBundle) { this.emitBundle = emitBundle; }

        public String getBundlePath() { return bundlePath; }
        public void setBundlePath(String bundlePath) { this.bundlePath = bundlePath; }

        public String getInputListFile() { return inputListFile; }
        public void setInputListFile(String inputListFile) { this.inputListFile = inputListFile; }

        public int getTopK() { return topK; }
        public void setTopK(int topK) { this.topK = topK; }

        public boolean isComputeSoftmax() { return computeSoftmax; }
        public void setComputeSoftmax(boolean computeSoftmax) { this.computeSoftmax = computeSoftmax; }

        public int getLabelOffset() { return labelOffset; }
        public void setLabelOffset(int labelOffset) { this.labelOffset = labelOffset; }

        public List<Integer> getExpectedLabels() { return expectedLabels; }
        public void setExpectedLabels(List<Integer> expectedLabels) { this.expectedLabels = expectedLabels; }

        public long getRunTimeoutMs() { return runTimeoutMs; }
        public void setRunTimeoutMs(long runTimeoutMs) { this.runTimeoutMs = runTimeoutMs; }

        /**
         * Parallel workers are disallowed when profiling or emitting a bundle.
         */
        public boolean isParallelAllowed() {
            return !profiling && !emitBundle;
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "inference_runner";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
