package fr.lapetina.inference.domain.model;

import java.util.Objects;

/**
 * One inference job: its position in the master list and its input file.
 */
public record Job(int index, String descriptor) {

    public Job {
        if (index < 0) {
            throw new IllegalArgumentException("Job index must be non-negative: " + index);
        }
        Objects.requireNonNull(descriptor, "Job descriptor is required");
    }
}
