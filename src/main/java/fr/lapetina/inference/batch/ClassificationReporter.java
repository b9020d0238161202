package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.Job;
import fr.lapetina.inference.domain.model.Tensor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.PriorityQueue;

/**
 * Turns classifier outputs into result lines and counts mismatches against
 * the expected labels.
 *
 * Stateless, shared by all workers.
 */
public final class ClassificationReporter {

    /** Lines after the first are tabbed out to align with Label-K1 */
    private static final String CONTINUATION_INDENT = "\t\t\t\t\t";

    private final int topK;
    private final boolean computeSoftmax;
    private final int labelOffset;
    private final List<Integer> expectedLabels;

    public ClassificationReporter(int topK, boolean computeSoftmax, int labelOffset, List<Integer> expectedLabels) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be positive: " + topK);
        }
        this.topK = topK;
        this.computeSoftmax = computeSoftmax;
        this.labelOffset = labelOffset;
        this.expectedLabels = expectedLabels != null ? List.copyOf(expectedLabels) : List.of();
    }

    /**
     * A scored label index.
     */
    public record LabelScore(int index, float probability) {
    }

    /**
     * Result lines for one chunk plus the number of mismatches they contain.
     * A failed chunk is one whose run produced no output.
     */
    public record ChunkReport(List<String> lines, int mismatches, boolean failed) {
        public ChunkReport {
            lines = List.copyOf(lines);
        }
    }

    /**
     * Reports a successful run.
     *
     * @param jobs   the chunk's jobs, in batch order
     * @param output classifier output, [batch, labels]
     */
    public ChunkReport report(List<Job> jobs, Tensor output) {
        if (output.getType().rank() < 2 || output.getType().dim(0) != jobs.size()) {
            throw new IllegalArgumentException(
                    "Output " + output.getType() + " does not hold one row per job (" + jobs.size() + ")");
        }
        int labels = output.getType().dim(1);
        if (topK > labels) {
            throw new IllegalArgumentException("topK " + topK + " exceeds label count " + labels);
        }

        List<String> lines = new ArrayList<>();
        int mismatches = 0;
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            float[] scores = output.row(i);
            if (computeSoftmax) {
                softmax(scores);
            }
            List<LabelScore> best = topK(scores, topK);
            for (int k = 0; k < best.size(); k++) {
                String prefix = k == 0 ? " File: " + job.descriptor() : CONTINUATION_INDENT;
                lines.add(prefix + "\tLabel-K" + (k + 1) + ": " + (best.get(k).index() - labelOffset)
                        + " (probability: " + String.format(Locale.ROOT, "%.4f", best.get(k).probability()) + ")");
            }
            if (!expectedLabels.isEmpty() && !matches(best, expectedLabels.get(job.index()))) {
                lines.add(" File: " + job.descriptor() + " doesn't match index: "
                        + expectedLabels.get(job.index()) + " in the top " + best.size() + " pairs");
                mismatches++;
            }
        }
        return new ChunkReport(lines, mismatches, false);
    }

    /**
     * Reports a chunk whose run failed; every job in it counts as a mismatch.
     */
    public ChunkReport reportFailure(List<Job> jobs, String reason) {
        List<String> lines = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            lines.add(" File: " + job.descriptor() + " failed: " + reason);
        }
        return new ChunkReport(lines, jobs.size(), true);
    }

    private boolean matches(List<LabelScore> best, int expected) {
        for (LabelScore score : best) {
            if (score.index() - labelOffset == expected) {
                return true;
            }
        }
        return false;
    }

    /**
     * The k highest scores, highest first. Of equal scores the lower index
     * wins and comes first.
     */
    public static List<LabelScore> topK(float[] scores, int k) {
        if (k > scores.length) {
            throw new IllegalArgumentException("k " + k + " exceeds score count " + scores.length);
        }
        Comparator<LabelScore> ranking = Comparator.comparingDouble(LabelScore::probability)
                .thenComparing(LabelScore::index, Comparator.reverseOrder());

        // Min-heap: the head is the weakest of the current best k
        PriorityQueue<LabelScore> heap = new PriorityQueue<>(k, ranking);
        for (int i = 0; i < scores.length; i++) {
            LabelScore candidate = new LabelScore(i, scores[i]);
            if (heap.size() < k) {
                heap.add(candidate);
            } else if (ranking.compare(candidate, heap.peek()) > 0) {
                heap.poll();
                heap.add(candidate);
            }
        }

        List<LabelScore> best = new ArrayList<>(heap);
        best.sort(ranking.reversed());
        return best;
    }

    public static void softmax(float[] values) {
        float max = Float.NEGATIVE_INFINITY;
        for (float v : values) {
            max = Math.max(max, v);
        }
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) Math.exp(values[i] - max);
            sum += values[i];
        }
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) (values[i] / sum);
        }
    }

    public int getTopK() {
        return topK;
    }
}
