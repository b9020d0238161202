package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.BatchRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchPartitionerTest {

    @Nested
    @DisplayName("concrete scenarios")
    class Scenarios {

        @Test
        @DisplayName("10 jobs on 3 threads should give [0,4) [4,8) [8,10)")
        void tenJobsThreeThreads() {
            assertThat(BatchPartitioner.partition(10, 1, 3, true)).containsExactly(
                    new BatchRange(0, 4), new BatchRange(4, 8), new BatchRange(8, 10));
        }

        @Test
        @DisplayName("6 jobs on 6 threads should give six single-job ranges")
        void sixJobsSixThreads() {
            List<BatchRange> ranges = BatchPartitioner.partition(6, 1, 6, true);

            assertThat(ranges).hasSize(6).allMatch(r -> r.size() == 1);
        }

        @Test
        @DisplayName("no jobs should give no ranges")
        void noJobs() {
            assertThat(BatchPartitioner.partition(0, 1, 4, true)).isEmpty();
            assertThat(BatchPartitioner.partition(0, 1, 4, false)).isEmpty();
        }

        @Test
        @DisplayName("should clamp threads to the number of units")
        void shouldClampThreads() {
            assertThat(BatchPartitioner.partition(3, 1, 8, true)).hasSize(3);
        }

        @Test
        @DisplayName("should split on mini-batch boundaries")
        void shouldSplitOnMiniBatches() {
            assertThat(BatchPartitioner.partition(12, 2, 3, true)).containsExactly(
                    new BatchRange(0, 4), new BatchRange(4, 8), new BatchRange(8, 12));
            assertThat(BatchPartitioner.partition(10, 2, 2, true)).containsExactly(
                    new BatchRange(0, 6), new BatchRange(6, 10));
        }

        @Test
        @DisplayName("disallowed parallelism should give a single range over all jobs")
        void forcedSingleRange() {
            for (int threads = 1; threads <= 8; threads++) {
                assertThat(BatchPartitioner.partition(10, 1, threads, false))
                        .containsExactly(new BatchRange(0, 10));
            }
        }

        @Test
        @DisplayName("trailing ranges may be empty when units do not spread evenly")
        void trailingEmptyRange() {
            assertThat(BatchPartitioner.partition(5, 1, 4, true)).containsExactly(
                    new BatchRange(0, 2), new BatchRange(2, 4), new BatchRange(4, 5), new BatchRange(5, 5));
        }
    }

    @Test
    @DisplayName("ranges should be disjoint, contiguous and cover every job")
    void rangesShouldCoverAllJobs() {
        for (int jobs = 0; jobs <= 40; jobs++) {
            for (int threads = 1; threads <= 9; threads++) {
                List<BatchRange> ranges = BatchPartitioner.partition(jobs, 1, threads, true);

                int expectedStart = 0;
                for (BatchRange range : ranges) {
                    assertThat(range.start()).isEqualTo(expectedStart);
                    expectedStart = range.end();
                }
                assertThat(expectedStart).isEqualTo(jobs);

                int perThread = ranges.isEmpty() ? 0 : ranges.get(0).size();
                List<BatchRange> nonEmpty = ranges.stream().filter(r -> !r.isEmpty()).toList();
                for (int i = 0; i < nonEmpty.size() - 1; i++) {
                    assertThat(nonEmpty.get(i).size()).isEqualTo(perThread);
                }
                if (!nonEmpty.isEmpty()) {
                    assertThat(nonEmpty.get(nonEmpty.size() - 1).size()).isBetween(1, perThread);
                }
            }
        }
    }

    @Test
    @DisplayName("should reject invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> BatchPartitioner.partition(10, 1, 0, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BatchPartitioner.partition(10, 0, 2, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BatchPartitioner.partition(10, 3, 2, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BatchPartitioner.partition(-1, 1, 2, true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
