package fr.lapetina.inference.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Dense float-backed tensor.
 *
 * Not thread-safe: a tensor belongs to whichever thread currently holds the
 * execution context it sits in.
 */
public final class Tensor {

    private final TensorType type;
    private final float[] data;

    public Tensor(TensorType type) {
        this.type = Objects.requireNonNull(type, "Tensor type is required");
        this.data = new float[type.size()];
    }

    public Tensor(TensorType type, float[] data) {
        this.type = Objects.requireNonNull(type, "Tensor type is required");
        Objects.requireNonNull(data, "Tensor data is required");
        if (data.length != type.size()) {
            throw new IllegalArgumentException(
                    "Data length " + data.length + " does not match type " + type);
        }
        this.data = data;
    }

    public TensorType getType() {
        return type;
    }

    public ElemKind getElemKind() {
        return type.elemKind();
    }

    public int size() {
        return data.length;
    }

    public float get(int index) {
        return data[index];
    }

    /**
     * Stores a value, rounding it to half precision for FLOAT16 tensors.
     */
    public void set(int index, float value) {
        data[index] = type.elemKind() == ElemKind.FLOAT16 ? ElemKind.roundToFloat16(value) : value;
    }

    /**
     * Returns a copy of the elements.
     */
    public float[] toArray() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Returns a tensor of the given element kind holding the same values.
     */
    public Tensor convertTo(ElemKind elemKind) {
        if (elemKind == type.elemKind()) {
            return this;
        }
        Tensor converted = new Tensor(new TensorType(elemKind, type.dims()));
        for (int i = 0; i < data.length; i++) {
            converted.set(i, data[i]);
        }
        return converted;
    }

    /**
     * Returns the elements of row {@code row} of a tensor viewed as
     * [rows, size / rows].
     */
    public float[] row(int row) {
        int rows = type.dim(0);
        int width = data.length / rows;
        return Arrays.copyOfRange(data, row * width, (row + 1) * width);
    }

    @Override
    public String toString() {
        return "Tensor{type=" + type + "}";
    }
}
