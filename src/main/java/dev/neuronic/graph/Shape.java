package dev.neuronic.graph;

import java.util.Arrays;

/**
 * Represents the shape of a tensor (multi-dimensional array).
 * This class is immutable.
 *
 * <p>A dimension equal to {@link #UNKNOWN} is undetermined, typically the batch size of a
 * symbolic value. Concrete tensors always have fully defined shapes.
 */
public record Shape(int[] dims) {

    public static final int UNKNOWN = -1;

    public Shape {
        dims = dims.clone();
        for (int dim : dims) {
            if (dim < 0 && dim != UNKNOWN)
                throw new IllegalArgumentException("Invalid dimension " + dim + " in " + Arrays.toString(dims));
        }
    }

    public static Shape scalar() {
        return new Shape(new int[0]);
    }

    public static Shape vector(int size) {
        return new Shape(new int[]{size});
    }

    public static Shape sequence(int sequenceLength, int features) {
        return new Shape(new int[]{sequenceLength, features});
    }

    public static Shape of(int... dimensions) {
        return new Shape(dimensions);
    }

    /**
     * Shape with an undetermined leading batch dimension followed by the given feature dimensions.
     */
    public static Shape batched(int... featureDims) {
        int[] dims = new int[featureDims.length + 1];
        dims[0] = UNKNOWN;
        System.arraycopy(featureDims, 0, dims, 1, featureDims.length);
        return new Shape(dims);
    }

    @Override
    public int[] dims() {
        return dims.clone();
    }

    public int rank() {
        return dims.length;
    }

    public int dim(int i) {
        return dims[i];
    }

    public int last() {
        return dims[dims.length - 1];
    }

    public boolean isKnown(int i) {
        return dims[i] != UNKNOWN;
    }

    public boolean isFullyDefined() {
        for (int dim : dims) {
            if (dim == UNKNOWN)
                return false;
        }
        return true;
    }

    public int toFlatSize() {
        int size = 1;
        for (int dim : dims) {
            if (dim == UNKNOWN)
                throw new IllegalStateException("Flat size of " + this + " is undetermined");
            size *= dim;
        }
        return size;
    }

    /**
     * Product of the dimensions from {@code fromAxis} to the end, or {@link #UNKNOWN} when any of
     * them is undetermined.
     */
    public int flatSizeFrom(int fromAxis) {
        int size = 1;
        for (int i = fromAxis; i < dims.length; i++) {
            if (dims[i] == UNKNOWN)
                return UNKNOWN;
            size *= dims[i];
        }
        return size;
    }

    /**
     * True when both shapes have the same rank and every pair of dimensions is equal or at least
     * one side is undetermined.
     */
    public boolean isCompatibleWith(Shape other) {
        if (other.rank() != rank())
            return false;
        for (int i = 0; i < dims.length; i++) {
            if (dims[i] != UNKNOWN && other.dims[i] != UNKNOWN && dims[i] != other.dims[i])
                return false;
        }
        return true;
    }

    public Shape withDim(int axis, int size) {
        int[] copy = dims.clone();
        copy[axis] = size;
        return new Shape(copy);
    }

    public Shape prepend(int dim) {
        int[] copy = new int[dims.length + 1];
        copy[0] = dim;
        System.arraycopy(dims, 0, copy, 1, dims.length);
        return new Shape(copy);
    }

    public Shape dropFirst() {
        if (dims.length == 0)
            throw new IllegalStateException("Cannot drop a dimension from a scalar shape");
        return new Shape(Arrays.copyOfRange(dims, 1, dims.length));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Shape other && Arrays.equals(dims, other.dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Shape[");
        for (int i = 0; i < dims.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(dims[i] == UNKNOWN ? "?" : String.valueOf(dims[i]));
        }
        return sb.append(']').toString();
    }
}
