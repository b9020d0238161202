package fr.lapetina.inference.compiler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import fr.lapetina.inference.device.CompiledFunction;
import fr.lapetina.inference.device.DeviceException;
import fr.lapetina.inference.domain.model.DeviceErrorType;
import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.Tensor;
import fr.lapetina.inference.domain.model.TensorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles a dense classification layer stored as JSON.
 *
 * The model file is read on every {@link #compile} call, so each caller gets
 * its own weights and function instance.
 */
public final class DenseModelCompiler implements ModelCompiler {

    private static final Logger log = LoggerFactory.getLogger(DenseModelCompiler.class);

    private final Path modelPath;
    private final String inputName;
    private final ObjectMapper objectMapper;

    public DenseModelCompiler(Path modelPath, String inputName) {
        this.modelPath = modelPath;
        this.inputName = inputName;
        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public CompiledModel compile(String networkName, TensorType inputType) throws ModelCompilationException {
        DenseModelDefinition definition = readDefinition();

        if (inputType.rank() < 2) {
            throw new ModelCompilationException("Input must have a batch dimension, got " + inputType);
        }
        int batch = inputType.dim(0);
        int features = inputType.size() / Math.max(batch, 1);
        int classes = definition.getWeights().size();

        if (classes == 0) {
            throw new ModelCompilationException("Model has no weights: " + modelPath);
        }
        if (definition.getBias().size() != classes) {
            throw new ModelCompilationException(
                    "Bias has " + definition.getBias().size() + " entries for " + classes + " classes");
        }
        float[][] weights = new float[classes][];
        for (int c = 0; c < classes; c++) {
            List<Float> row = definition.getWeights().get(c);
            if (row.size() != features) {
                throw new ModelCompilationException("Weight row " + c + " has " + row.size()
                        + " entries, input " + inputType + " has " + features + " features per sample");
            }
            weights[c] = toArray(row);
        }
        float[] bias = toArray(definition.getBias());

        TensorType outputType = TensorType.of(inputType.elemKind(), batch, classes);
        DenseFunction function = new DenseFunction(
                inputName, definition.getOutputName(), inputType, outputType,
                weights, bias, definition.isSoftmax());

        log.info("Model compiled: network={}, inputType={}, outputType={}", networkName, inputType, outputType);
        return new CompiledModel(networkName, inputName, definition.getOutputName(),
                inputType, outputType, function);
    }

    @Override
    public void emitBundle(CompiledModel model, Path bundlePath) throws ModelCompilationException {
        if (!(model.function() instanceof DenseFunction function)) {
            throw new ModelCompilationException("Not compiled by this compiler: " + model.networkName());
        }

        DenseModelDefinition bundle = new DenseModelDefinition();
        bundle.setName(model.networkName());
        bundle.setOutputName(model.outputName());
        bundle.setSoftmax(function.softmax);
        bundle.setInputDims(model.inputType().dims());
        bundle.setBias(toList(function.bias));
        List<List<Float>> rows = new ArrayList<>();
        for (float[] row : function.weights) {
            rows.add(toList(row));
        }
        bundle.setWeights(rows);

        try {
            Path parent = bundlePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(bundlePath.toFile(), bundle);
        } catch (IOException e) {
            throw new ModelCompilationException("Failed to write bundle: " + bundlePath, e);
        }
        log.info("Bundle written: network={}, path={}", model.networkName(), bundlePath);
    }

    @Override
    public String getModelDescription() {
        return modelPath.toString();
    }

    private DenseModelDefinition readDefinition() throws ModelCompilationException {
        try {
            return objectMapper.readValue(modelPath.toFile(), DenseModelDefinition.class);
        } catch (IOException e) {
            throw new ModelCompilationException("Failed to read model: " + modelPath, e);
        }
    }

    private static float[] toArray(List<Float> values) {
        float[] array = new float[values.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    private static List<Float> toList(float[] values) {
        Float[] boxed = new Float[values.length];
        for (int i = 0; i < values.length; i++) {
            boxed[i] = values[i];
        }
        return List.of(boxed);
    }

    /**
     * The compiled layer. Holds its own copy of the weights.
     */
    static final class DenseFunction implements CompiledFunction {
        private final String inputName;
        private final String outputName;
        private final TensorType inputType;
        private final TensorType outputType;
        private final float[][] weights;
        private final float[] bias;
        private final boolean softmax;

        DenseFunction(String inputName, String outputName, TensorType inputType, TensorType outputType,
                      float[][] weights, float[] bias, boolean softmax) {
            this.inputName = inputName;
            this.outputName = outputName;
            this.inputType = inputType;
            this.outputType = outputType;
            this.weights = weights;
            this.bias = bias;
            this.softmax = softmax;
        }

        @Override
        public Map<String, TensorType> getInputTypes() {
            return Map.of(inputName, inputType);
        }

        @Override
        public void execute(ExecutionContext context) throws DeviceException {
            Tensor input = context.get(inputName).orElseThrow(() ->
                    new DeviceException(DeviceErrorType.SHAPE_MISMATCH, "Input not bound: " + inputName));

            int batch = outputType.dim(0);
            int classes = outputType.dim(1);
            Tensor output = new Tensor(outputType);
            float[] logits = new float[classes];

            for (int n = 0; n < batch; n++) {
                float[] sample = input.row(n);
                for (int c = 0; c < classes; c++) {
                    float sum = bias[c];
                    float[] w = weights[c];
                    for (int i = 0; i < w.length; i++) {
                        sum += w[i] * sample[i];
                    }
                    logits[c] = sum;
                }
                if (softmax) {
                    softmaxInPlace(logits);
                }
                for (int c = 0; c < classes; c++) {
                    output.set(n * classes + c, logits[c]);
                }
            }
            context.bind(outputName, output);
        }

        private static void softmaxInPlace(float[] values) {
            float max = Float.NEGATIVE_INFINITY;
            for (float v : values) {
                max = Math.max(max, v);
            }
            double sum = 0;
            for (int i = 0; i < values.length; i++) {
                values[i] = (float) Math.exp(values[i] - max);
                sum += values[i];
            }
            for (int i = 0; i < values.length; i++) {
                values[i] = (float) (values[i] / sum);
            }
        }
    }
}
