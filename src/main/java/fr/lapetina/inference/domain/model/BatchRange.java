package fr.lapetina.inference.domain.model;

/**
 * Half-open interval {@code [start, end)} into the master job list.
 */
public record BatchRange(int start, int end) {

    public BatchRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
        }
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
