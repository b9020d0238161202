package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.BatchRange;
import fr.lapetina.inference.domain.model.Job;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a worker's range of the master job list, either in one chunk or in
 * successive mini-batches.
 */
public final class RangeBatchSource implements BatchSource {

    private final List<String> jobs;
    private final BatchRange range;
    private final int chunkSize;
    private int next;

    /**
     * @param jobs      the master job list
     * @param range     the part of it this source covers
     * @param miniBatch chunk size, or 0 for the whole range at once
     */
    public RangeBatchSource(List<String> jobs, BatchRange range, int miniBatch) {
        if (range.end() > jobs.size()) {
            throw new IllegalArgumentException("Range " + range + " exceeds job count " + jobs.size());
        }
        this.jobs = jobs;
        this.range = range;
        this.chunkSize = miniBatch > 0 ? miniBatch : Math.max(range.size(), 1);
        this.next = range.start();
    }

    @Override
    public Optional<List<Job>> nextChunk() {
        if (next >= range.end()) {
            return Optional.empty();
        }
        int end = Math.min(next + chunkSize, range.end());
        List<Job> chunk = new ArrayList<>(end - next);
        for (int i = next; i < end; i++) {
            chunk.add(new Job(i, jobs.get(i)));
        }
        next = end;
        return Optional.of(chunk);
    }

    public BatchRange getRange() {
        return range;
    }
}
