package fr.lapetina.inference.preprocess;

/**
 * Target value range for pixel normalization.
 */
public enum ImageNormalizationMode {
    NEG1TO1("neg1to1", -1f, 1f),
    ZERO_TO_1("0to1", 0f, 1f),
    ZERO_TO_255("0to255", 0f, 255f),
    NEG128TO127("neg128to127", -128f, 127f);

    private final String configName;
    private final float min;
    private final float max;

    ImageNormalizationMode(String configName, float min, float max) {
        this.configName = configName;
        this.min = min;
        this.max = max;
    }

    public String getConfigName() {
        return configName;
    }

    public float getMin() {
        return min;
    }

    public float getMax() {
        return max;
    }

    /**
     * Factor mapping the 0..255 pixel range onto this range.
     */
    public float getScale() {
        return (max - min) / 255f;
    }

    /**
     * Parses either the configuration name ({@code 0to1}) or the constant name.
     */
    public static ImageNormalizationMode fromName(String name) {
        for (ImageNormalizationMode mode : values()) {
            if (mode.configName.equalsIgnoreCase(name) || mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown normalization mode: " + name);
    }
}
