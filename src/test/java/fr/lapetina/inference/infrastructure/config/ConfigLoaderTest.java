package fr.lapetina.inference.infrastructure.config;

import fr.lapetina.inference.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should load from the classpath and keep defaults for missing keys")
        void shouldLoadFromClasspath() {
            RunnerConfig config = new ConfigLoader("test-runner.yaml").load();

            assertThat(config.getExecutor().getRingBufferSize()).isEqualTo(64);
            assertThat(config.getExecutor().getWaitStrategy()).isEqualTo("sleeping");
            assertThat(config.getDevice().getMaxNetworks()).isEqualTo(4);
            assertThat(config.getDevice().getKind()).isEqualTo("cpu");
            assertThat(config.getModel().getNetworkName()).isEqualTo("test-net");
            assertThat(config.getModel().getInputName()).isEqualTo("data");
            assertThat(config.getBatch().getThreads()).isEqualTo(3);
            assertThat(config.getBatch().getMiniBatch()).isEqualTo(2);
            assertThat(config.getBatch().getTopK()).isEqualTo(2);
            assertThat(config.getBatch().isComputeSoftmax()).isTrue();
            assertThat(config.getBatch().getLabelOffset()).isEqualTo(1);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("test_runner");
        }

        @Test
        @DisplayName("absent sections should get their defaults")
        void absentSectionsShouldDefault() {
            RunnerConfig config = new ConfigLoader("test-runner.yaml").load();

            assertThat(config.getPreprocessing().getNormalizationMode()).isEqualTo("0to1");
            assertThat(config.getPreprocessing().getChannelOrder()).isEqualTo("BGR");
            assertThat(config.getPreprocessing().getLayout()).isEqualTo("NCHW");
            assertThat(config.getPreprocessing().getMean()).isEmpty();
        }

        @Test
        @DisplayName("should prefer a file on disk")
        void shouldLoadFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("runner.yaml");
            Files.writeString(file, """
                    batch:
                      threads: 5
                      expectedLabels: [1, 2, 3]
                    preprocessing:
                      normalizationMode: neg1to1
                      mean: [1.0, 2.0, 3.0]
                    """);

            RunnerConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getBatch().getThreads()).isEqualTo(5);
            assertThat(config.getBatch().getExpectedLabels()).containsExactly(1, 2, 3);
            assertThat(config.getPreprocessing().getNormalizationMode()).isEqualTo("neg1to1");
            assertThat(config.getPreprocessing().getMean()).containsExactly(1.0, 2.0, 3.0);
        }

        @Test
        @DisplayName("an empty document should give the default configuration")
        void emptyDocument() {
            RunnerConfig config = new ConfigLoader("unused")
                    .loadFromStream(new ByteArrayInputStream(new byte[0]));

            assertThat(config.getBatch().getThreads()).isEqualTo(1);
            assertThat(config.getExecutor().getRingBufferSize()).isEqualTo(1024);
            assertThat(config.getMetrics().isEnabled()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should fail when the file exists nowhere")
        void missingFile() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should reject unknown keys")
        void unknownKey() {
            String yaml = "batch:\n  threadz: 2\n";

            assertThatThrownBy(() -> new ConfigLoader("unused")
                    .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject values of the wrong type")
        void wrongType() {
            String yaml = "batch:\n  threads: many\n";

            assertThatThrownBy(() -> new ConfigLoader("unused")
                    .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    @DisplayName("parallel execution should be refused when profiling or emitting a bundle")
    void parallelAllowed() {
        RunnerConfig.BatchConfig batch = new RunnerConfig.BatchConfig();
        assertThat(batch.isParallelAllowed()).isTrue();

        batch.setProfiling(true);
        assertThat(batch.isParallelAllowed()).isFalse();

        batch.setProfiling(false);
        batch.setEmitBundle(true);
        assertThat(batch.isParallelAllowed()).isFalse();
    }
}
