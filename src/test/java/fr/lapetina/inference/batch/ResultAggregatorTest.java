package fr.lapetina.inference.batch;

import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultAggregatorTest {

    private ByteArrayOutputStream buffer;
    private MetricsRegistry metricsRegistry;
    private ResultAggregator aggregator;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        metricsRegistry = new MetricsRegistry("test");
        aggregator = new ResultAggregator(new PrintStream(buffer, true, StandardCharsets.UTF_8), metricsRegistry);
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    @Test
    @DisplayName("should sum mismatches from concurrent reporters")
    void shouldSumConcurrentMismatches() throws Exception {
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            Thread worker = new Thread(() -> {
                for (int i = 0; i < 100; i++) {
                    aggregator.report(List.of("line"), 1);
                }
            });
            workers.add(worker);
            worker.start();
        }
        for (Thread worker : workers) {
            worker.join();
        }

        assertThat(aggregator.getMismatchCount()).isEqualTo(800);
        assertThat(aggregator.getReportCount()).isEqualTo(800);
        assertThat(metricsRegistry.getRegistry().get("test_job_mismatches_total").counter().count()).isEqualTo(800.0);
    }

    @Test
    @DisplayName("should keep the lines of one report together")
    void shouldNotInterleaveReports() throws Exception {
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            String id = "w" + t;
            Thread worker = new Thread(() -> {
                for (int i = 0; i < 50; i++) {
                    aggregator.report(List.of(id + "-a", id + "-b", id + "-c"), 0);
                }
            });
            workers.add(worker);
            worker.start();
        }
        for (Thread worker : workers) {
            worker.join();
        }

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\n");
        assertThat(lines).hasSize(600);
        for (int i = 0; i < lines.length; i += 3) {
            String id = lines[i].substring(0, 2);
            assertThat(lines[i]).isEqualTo(id + "-a");
            assertThat(lines[i + 1]).isEqualTo(id + "-b");
            assertThat(lines[i + 2]).isEqualTo(id + "-c");
        }
        assertThat(aggregator.getMismatchCount()).isZero();
    }
}
