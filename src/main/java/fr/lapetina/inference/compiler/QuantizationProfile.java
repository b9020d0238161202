package fr.lapetina.inference.compiler;

import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.Tensor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Value ranges observed per placeholder across profiled runs, written as YAML
 * for a later quantization step.
 *
 * Not thread-safe. Each worker keeps its own.
 */
public final class QuantizationProfile {

    private static final Logger log = LoggerFactory.getLogger(QuantizationProfile.class);

    private final Map<String, float[]> ranges = new LinkedHashMap<>();
    private int runCount;

    /**
     * Widens the recorded ranges with every tensor bound in the context.
     */
    public void record(ExecutionContext context) {
        for (Map.Entry<String, Tensor> entry : context.getPlaceholders().entrySet()) {
            Tensor tensor = entry.getValue();
            float[] range = ranges.computeIfAbsent(entry.getKey(),
                    k -> new float[]{Float.POSITIVE_INFINITY, Float.NEGATIVE_INFINITY});
            for (int i = 0; i < tensor.size(); i++) {
                float v = tensor.get(i);
                range[0] = Math.min(range[0], v);
                range[1] = Math.max(range[1], v);
            }
        }
        runCount++;
    }

    /**
     * Returns {@code [min, max]} for a placeholder.
     */
    public Optional<float[]> getRange(String placeholder) {
        float[] range = ranges.get(placeholder);
        return range == null ? Optional.empty() : Optional.of(range.clone());
    }

    public int getRunCount() {
        return runCount;
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public void writeTo(Path path) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("runs", runCount);
        Map<String, Object> placeholders = new LinkedHashMap<>();
        for (Map.Entry<String, float[]> entry : ranges.entrySet()) {
            Map<String, Object> range = new LinkedHashMap<>();
            range.put("min", (double) entry.getValue()[0]);
            range.put("max", (double) entry.getValue()[1]);
            placeholders.put(entry.getKey(), range);
        }
        document.put("placeholders", placeholders);

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path)) {
            new Yaml(options).dump(document, writer);
        }
        log.info("Profile written: path={}, runs={}, placeholders={}", path, runCount, ranges.size());
    }
}
