package fr.lapetina.inference.compiler;

import fr.lapetina.inference.device.CompiledFunction;
import fr.lapetina.inference.domain.model.TensorType;

import java.util.Objects;

/**
 * A model compiled for one input type: the function to load plus the names of
 * its input and output placeholders.
 */
public record CompiledModel(
        String networkName,
        String inputName,
        String outputName,
        TensorType inputType,
        TensorType outputType,
        CompiledFunction function
) {
    public CompiledModel {
        Objects.requireNonNull(networkName, "Network name is required");
        Objects.requireNonNull(inputName, "Input name is required");
        Objects.requireNonNull(outputName, "Output name is required");
        Objects.requireNonNull(inputType, "Input type is required");
        Objects.requireNonNull(outputType, "Output type is required");
        Objects.requireNonNull(function, "Compiled function is required");
    }
}
