package fr.lapetina.inference.batch;

/**
 * A batch worker could not complete its range: its model did not compile or
 * load, an input could not be read, or it was interrupted.
 */
public class BatchExecutionException extends RuntimeException {

    public BatchExecutionException(String message) {
        super(message);
    }

    public BatchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
