package fr.lapetina.inference.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Shape and element kind of a tensor. Two tensors are compatible when their
 * types are equal.
 */
public record TensorType(ElemKind elemKind, List<Integer> dims) {

    public TensorType {
        Objects.requireNonNull(elemKind, "Element kind is required");
        Objects.requireNonNull(dims, "Dimensions are required");
        dims = List.copyOf(dims);
        for (Integer dim : dims) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in " + dims);
            }
        }
    }

    public static TensorType of(ElemKind elemKind, int... dims) {
        Integer[] boxed = new Integer[dims.length];
        for (int i = 0; i < dims.length; i++) {
            boxed[i] = dims[i];
        }
        return new TensorType(elemKind, List.of(boxed));
    }

    /**
     * Total number of elements.
     */
    public int size() {
        int size = 1;
        for (int dim : dims) {
            size *= dim;
        }
        return size;
    }

    public int rank() {
        return dims.size();
    }

    public int dim(int axis) {
        return dims.get(axis);
    }

    /**
     * Same element kind with a different shape.
     */
    public TensorType withDims(int... newDims) {
        return of(elemKind, newDims);
    }

    @Override
    public String toString() {
        return elemKind + dims.toString();
    }
}
