package fr.lapetina.inference.compiler;

import fr.lapetina.inference.domain.model.TensorType;

import java.nio.file.Path;

/**
 * Imports a model and compiles it for a given input type.
 *
 * Every call to {@link #compile} returns an independent instance, so batch
 * workers never share compiled state.
 */
public interface ModelCompiler {

    /**
     * Compiles the model for inputs of the given type.
     *
     * @param networkName name the compiled function is loaded under
     * @param inputType   type of the input placeholder, batch dimension first
     */
    CompiledModel compile(String networkName, TensorType inputType) throws ModelCompilationException;

    /**
     * Writes the compiled model to a standalone bundle file.
     */
    void emitBundle(CompiledModel model, Path bundlePath) throws ModelCompilationException;

    /**
     * Where the model comes from, for display.
     */
    String getModelDescription();
}
