package fr.lapetina.inference.compiler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a single dense classification layer:
 * {@code logits = weights * input + bias}, optionally followed by softmax.
 * Also the bundle format written by {@link DenseModelCompiler}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DenseModelDefinition {

    private String name;

    @JsonProperty("output_name")
    private String outputName = "softmax";

    /** One row per class, each as wide as the flattened input */
    private List<List<Float>> weights = new ArrayList<>();

    private List<Float> bias = new ArrayList<>();

    private boolean softmax = true;

    @JsonProperty("input_dims")
    private List<Integer> inputDims;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getOutputName() { return outputName; }
    public void setOutputName(String outputName) { this.outputName = outputName; }

    public List<List<Float>> getWeights() { return weights; }
    public void setWeights(List<List<Float>> weights) { this.weights = weights; }

    public List<Float> getBias() { return bias; }
    public void setBias(List<Float> bias) { this.bias = bias; }

    public boolean isSoftmax() { return softmax; }
    public void setSoftmax(boolean softmax) { this.softmax = softmax; }

    public List<Integer> getInputDims() { return inputDims; }
    public void setInputDims(List<Integer> inputDims) { this.inputDims = inputDims; }
}
