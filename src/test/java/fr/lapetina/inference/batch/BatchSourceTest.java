package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.BatchRange;
import fr.lapetina.inference.domain.model.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchSourceTest {

    private static final List<String> JOBS = List.of("a", "b", "c", "d", "e", "f");

    @Test
    @DisplayName("range source without mini-batch should yield the whole range once")
    void wholeRange() {
        RangeBatchSource source = new RangeBatchSource(JOBS, new BatchRange(1, 5), 0);

        assertThat(source.nextChunk()).hasValueSatisfying(chunk ->
                assertThat(chunk).extracting(Job::descriptor).containsExactly("b", "c", "d", "e"));
        assertThat(source.nextChunk()).isEmpty();
    }

    @Test
    @DisplayName("range source should walk successive mini-batches with global indices")
    void miniBatches() {
        RangeBatchSource source = new RangeBatchSource(JOBS, new BatchRange(2, 6), 2);

        assertThat(source.nextChunk()).hasValueSatisfying(chunk ->
                assertThat(chunk).containsExactly(new Job(2, "c"), new Job(3, "d")));
        assertThat(source.nextChunk()).hasValueSatisfying(chunk ->
                assertThat(chunk).containsExactly(new Job(4, "e"), new Job(5, "f")));
        assertThat(source.nextChunk()).isEmpty();
    }

    @Test
    @DisplayName("empty range should yield nothing")
    void emptyRange() {
        assertThat(new RangeBatchSource(JOBS, new BatchRange(3, 3), 0).nextChunk()).isEmpty();
    }

    @Test
    @DisplayName("stream source should prompt and split lines until end of input")
    void streamSource() throws Exception {
        ByteArrayOutputStream prompts = new ByteArrayOutputStream();
        StreamBatchSource source = new StreamBatchSource(
                new BufferedReader(new StringReader("  x.png   y.png\nz.png\n")),
                new PrintStream(prompts, true, StandardCharsets.UTF_8));

        assertThat(source.nextChunk()).hasValueSatisfying(chunk ->
                assertThat(chunk).containsExactly(new Job(0, "x.png"), new Job(1, "y.png")));
        assertThat(source.nextChunk()).hasValueSatisfying(chunk ->
                assertThat(chunk).containsExactly(new Job(2, "z.png")));
        assertThat(source.nextChunk()).isEmpty();
        assertThat(prompts.toString(StandardCharsets.UTF_8))
                .isEqualTo(StreamBatchSource.PROMPT.repeat(3));
    }
}
