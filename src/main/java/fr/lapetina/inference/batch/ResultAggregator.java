package fr.lapetina.inference.batch;

import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The one object batch workers share: an output stream and a mismatch counter.
 *
 * Each report is written and counted under a single lock hold, so lines of
 * one report are never interleaved with another worker's. Reports from
 * different workers come out in whatever order they arrive.
 */
public final class ResultAggregator {

    private final PrintStream out;
    private final MetricsRegistry metricsRegistry;
    private final ReentrantLock lock = new ReentrantLock();

    private int mismatchCount;
    private int reportCount;

    public ResultAggregator(PrintStream out, MetricsRegistry metricsRegistry) {
        this.out = out;
        this.metricsRegistry = metricsRegistry;
    }

    public void report(List<String> lines, int mismatches) {
        if (mismatches < 0) {
            throw new IllegalArgumentException("Mismatch count must be non-negative: " + mismatches);
        }
        lock.lock();
        try {
            for (String line : lines) {
                out.println(line);
            }
            out.flush();
            mismatchCount += mismatches;
            reportCount++;
        } finally {
            lock.unlock();
        }
        metricsRegistry.incrementMismatches(mismatches);
    }

    /**
     * Writes lines that carry no result, such as a prompt or a warning.
     */
    public void print(String line) {
        lock.lock();
        try {
            out.println(line);
            out.flush();
        } finally {
            lock.unlock();
        }
    }

    public int getMismatchCount() {
        lock.lock();
        try {
            return mismatchCount;
        } finally {
            lock.unlock();
        }
    }

    public int getReportCount() {
        lock.lock();
        try {
            return reportCount;
        } finally {
            lock.unlock();
        }
    }
}
