package fr.lapetina.inference.domain.model;

/**
 * Correlates a run completion with the runFunction call that produced it.
 * Issued in strictly increasing order per device, never reused.
 */
public record RunIdentifier(long value) implements Comparable<RunIdentifier> {

    public RunIdentifier {
        if (value < 0) {
            throw new IllegalArgumentException("Run identifier must be non-negative: " + value);
        }
    }

    @Override
    public int compareTo(RunIdentifier other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "run-" + value;
    }
}
