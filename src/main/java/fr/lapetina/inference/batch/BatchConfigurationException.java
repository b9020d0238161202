package fr.lapetina.inference.batch;

/**
 * Inconsistent batch options, detected before any worker thread exists.
 */
public class BatchConfigurationException extends RuntimeException {

    public BatchConfigurationException(String message) {
        super(message);
    }
}
