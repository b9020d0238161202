package fr.lapetina.inference.batch;

/**
 * What one batch worker did.
 *
 * @param compilations number of times the worker compiled its model, 0 or 1
 */
public record WorkerResult(
        int workerId,
        int chunksProcessed,
        int jobsProcessed,
        int failedChunks,
        int compilations
) {
}
