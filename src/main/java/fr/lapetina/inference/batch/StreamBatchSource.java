package fr.lapetina.inference.batch;

import fr.lapetina.inference.domain.model.Job;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads chunks interactively: one line of whitespace-separated file names per
 * chunk, until an empty line or end of input.
 */
public final class StreamBatchSource implements BatchSource {

    static final String PROMPT = "Enter image filenames to classify: ";

    private final BufferedReader reader;
    private final PrintStream prompt;
    private int nextIndex;

    public StreamBatchSource(BufferedReader reader, PrintStream prompt) {
        this.reader = reader;
        this.prompt = prompt;
    }

    @Override
    public Optional<List<Job>> nextChunk() throws IOException {
        prompt.print(PROMPT);
        prompt.flush();

        String line = reader.readLine();
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        List<Job> chunk = new ArrayList<>();
        for (String name : line.trim().split("\\s+")) {
            chunk.add(new Job(nextIndex++, name));
        }
        return Optional.of(chunk);
    }
}
