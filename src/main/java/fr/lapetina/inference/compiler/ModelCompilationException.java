package fr.lapetina.inference.compiler;

/**
 * Thrown when a model cannot be loaded, compiled or written out as a bundle.
 */
public class ModelCompilationException extends Exception {

    public ModelCompilationException(String message) {
        super(message);
    }

    public ModelCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
