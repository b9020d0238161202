package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.BatchRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an ordered job list into contiguous per-thread ranges.
 *
 * Jobs are handed out in units (mini-batches, or single jobs when
 * mini-batching is off). Every thread gets {@code ceil(units / threads)}
 * units, except the last ones, which get what is left: with 10 jobs and 3
 * threads the ranges are [0,4) [4,8) [8,10).
 */
public final class BatchPartitioner {

    private BatchPartitioner() {
        // Utility class
    }

    /**
     * @param jobCount         number of jobs, a multiple of unitSize
     * @param unitSize         jobs per indivisible unit
     * @param requestedThreads threads asked for, at least 1
     * @param parallelAllowed  false forces a single range
     * @return one range per thread, in job order; empty when there are no jobs
     */
    public static List<BatchRange> partition(
            int jobCount,
            int unitSize,
            int requestedThreads,
            boolean parallelAllowed
    ) {
        if (jobCount < 0) {
            throw new IllegalArgumentException("Job count must be non-negative: " + jobCount);
        }
        if (unitSize < 1) {
            throw new IllegalArgumentException("Unit size must be positive: " + unitSize);
        }
        if (requestedThreads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + requestedThreads);
        }
        if (jobCount % unitSize != 0) {
            throw new IllegalArgumentException(
                    "Job count " + jobCount + " is not a multiple of the unit size " + unitSize);
        }

        int units = jobCount / unitSize;
        int threads = threadCount(units, requestedThreads, parallelAllowed);
        if (threads == 0) {
            return List.of();
        }

        int jobsPerThread = ((units + threads - 1) / threads) * unitSize;
        List<BatchRange> ranges = new ArrayList<>(threads);
        for (int i = 0; i < threads; i++) {
            int start = Math.min(i * jobsPerThread, jobCount);
            int end = Math.min((i + 1) * jobsPerThread, jobCount);
            ranges.add(new BatchRange(start, end));
        }
        return ranges;
    }

    /**
     * Number of threads a partition will use.
     */
    public static int threadCount(int units, int requestedThreads, boolean parallelAllowed) {
        return parallelAllowed ? Math.min(requestedThreads, units) : Math.min(1, units);
    }
}
