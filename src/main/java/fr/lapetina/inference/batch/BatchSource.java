package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.Job;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Supplies a worker with successive chunks of jobs.
 */
public interface BatchSource {

    /**
     * @return the next chunk, or empty once the source is exhausted
     */
    Optional<List<Job>> nextChunk() throws IOException;
}
