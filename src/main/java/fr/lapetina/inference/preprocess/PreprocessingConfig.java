package fr.lapetina.inference.preprocess;

import fr.lapetina.inference.infrastructure.config.RunnerConfig;

import java.util.List;
import java.util.Objects;

/**
 * Validated image preprocessing options, shared read-only by all workers.
 *
 * {@code mean} and {@code stddev} are given per tensor channel, in the
 * configured channel order.
 */
public record PreprocessingConfig(
        ImageNormalizationMode normalizationMode,
        ImageChannelOrder channelOrder,
        ImageLayout layout,
        List<Double> mean,
        List<Double> stddev,
        boolean convertToFloat16
) {
    public static final int CHANNELS = 3;

    /** Imagenet statistics in RGB order, for pixel values in 0..255 */
    static final double[] IMAGENET_MEAN = {0.485 * 255.0, 0.456 * 255.0, 0.406 * 255.0};
    static final double[] IMAGENET_STDDEV = {0.229, 0.224, 0.225};

    public PreprocessingConfig {
        Objects.requireNonNull(normalizationMode, "Normalization mode is required");
        Objects.requireNonNull(channelOrder, "Channel order is required");
        Objects.requireNonNull(layout, "Layout is required");
        mean = mean == null || mean.isEmpty() ? List.of(0.0, 0.0, 0.0) : copyValues(mean, "mean");
        stddev = stddev == null || stddev.isEmpty() ? List.of(1.0, 1.0, 1.0) : copyValues(stddev, "stddev");

        if (mean.size() != CHANNELS) {
            throw new IllegalArgumentException("Expected " + CHANNELS + " mean values, got " + mean.size());
        }
        if (stddev.size() != CHANNELS) {
            throw new IllegalArgumentException("Expected " + CHANNELS + " stddev values, got " + stddev.size());
        }
        for (Double s : stddev) {
            if (s == 0.0) {
                throw new IllegalArgumentException("Stddev values must be non-zero: " + stddev);
            }
        }
    }

    private static List<Double> copyValues(List<Double> values, String what) {
        for (Double value : values) {
            if (value == null) {
                throw new IllegalArgumentException("Missing " + what + " value in " + values);
            }
        }
        return List.copyOf(values);
    }

    public static PreprocessingConfig defaults() {
        return new PreprocessingConfig(ImageNormalizationMode.ZERO_TO_1, ImageChannelOrder.BGR,
                ImageLayout.NCHW, List.of(), List.of(), false);
    }

    /**
     * Validates raw settings loaded from YAML.
     *
     * @throws IllegalArgumentException on unknown names or inconsistent values
     */
    public static PreprocessingConfig fromSettings(RunnerConfig.PreprocessingSettings settings) {
        ImageNormalizationMode mode = ImageNormalizationMode.fromName(settings.getNormalizationMode());
        ImageChannelOrder order = parse(ImageChannelOrder.class, settings.getChannelOrder(), "channel order");
        ImageLayout layout = parse(ImageLayout.class, settings.getLayout(), "layout");

        // An empty YAML key gives a null list
        List<Double> mean = settings.getMean() != null ? settings.getMean() : List.of();
        List<Double> stddev = settings.getStddev() != null ? settings.getStddev() : List.of();
        if (settings.isUseImagenetNormalization()) {
            if (mode != ImageNormalizationMode.ZERO_TO_255) {
                throw new IllegalArgumentException("Imagenet normalization requires the 0to255 range");
            }
            if (!mean.isEmpty() || !stddev.isEmpty()) {
                throw new IllegalArgumentException("Imagenet normalization cannot be combined with mean/stddev");
            }
            mean = inChannelOrder(IMAGENET_MEAN, order);
            stddev = inChannelOrder(IMAGENET_STDDEV, order);
        }
        return new PreprocessingConfig(mode, order, layout, mean, stddev, settings.isConvertToFloat16());
    }

    private static List<Double> inChannelOrder(double[] rgb, ImageChannelOrder order) {
        Double[] values = new Double[CHANNELS];
        for (int c = 0; c < CHANNELS; c++) {
            values[c] = rgb[order.colorAt(c)];
        }
        return List.of(values);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, String what) {
        try {
            return Enum.valueOf(type, value.toUpperCase());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown " + what + ": " + value, e);
        }
    }

    /**
     * Normalizes one 0..255 pixel value of a tensor channel.
     */
    public float normalize(int pixel, int channel) {
        double centered = (pixel - mean.get(channel)) / stddev.get(channel);
        return (float) (centered * normalizationMode.getScale() + normalizationMode.getMin());
    }
}
