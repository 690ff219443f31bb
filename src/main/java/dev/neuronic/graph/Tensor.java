package dev.neuronic.graph;

import java.util.Arrays;

/**
 * Concrete, immutable tensor value: a fully defined shape, an element type and row-major
 * storage.
 *
 * <p>Numeric and boolean tensors keep their elements in a {@code float[]} (integers are stored
 * as whole floats, booleans as 0 or 1). String tensors keep a {@code String[]}. Accessors hand
 * out copies so a tensor shared between a feed and a layer can never be modified in place.
 */
public final class Tensor {

    private final Shape shape;
    private final DataType dtype;
    private final float[] values;
    private final String[] strings;

    private Tensor(Shape shape, DataType dtype, float[] values, String[] strings) {
        this.shape = shape;
        this.dtype = dtype;
        this.values = values;
        this.strings = strings;
    }

    public static Tensor of(Shape shape, float... values) {
        return of(shape, DataType.FLOAT32, values);
    }

    public static Tensor of(Shape shape, DataType dtype, float... values) {
        if (dtype == DataType.STRING)
            throw new IllegalArgumentException("Use Tensor.strings() for string tensors");
        checkShape(shape, values.length);
        float[] copy = values.clone();
        normalize(copy, dtype);
        return new Tensor(shape, dtype, copy, null);
    }

    public static Tensor strings(Shape shape, String... values) {
        checkShape(shape, values.length);
        return new Tensor(shape, DataType.STRING, null, values.clone());
    }

    public static Tensor scalar(float value) {
        return of(Shape.scalar(), value);
    }

    public static Tensor vector(float... values) {
        return of(Shape.vector(values.length), values);
    }

    /**
     * Rank-2 tensor from rows of equal length.
     */
    public static Tensor matrix(float[][] rows) {
        int cols = rows.length == 0 ? 0 : rows[0].length;
        float[] data = new float[rows.length * cols];
        for (int r = 0; r < rows.length; r++) {
            if (rows[r].length != cols)
                throw new IllegalArgumentException("Ragged matrix: row " + r + " has " + rows[r].length + " columns, expected " + cols);
            System.arraycopy(rows[r], 0, data, r * cols, cols);
        }
        return new Tensor(Shape.of(rows.length, cols), DataType.FLOAT32, data, null);
    }

    public static Tensor zeros(Shape shape) {
        return fill(shape, DataType.FLOAT32, 0f);
    }

    public static Tensor ones(Shape shape) {
        return fill(shape, DataType.FLOAT32, 1f);
    }

    public static Tensor fill(Shape shape, DataType dtype, float value) {
        float[] data = new float[shape.toFlatSize()];
        Arrays.fill(data, value);
        return of(shape, dtype, data);
    }

    /**
     * Wraps freshly computed storage without copying. The caller must not keep a reference to
     * {@code values}.
     */
    public static Tensor wrap(Shape shape, DataType dtype, float[] values) {
        checkShape(shape, values.length);
        return new Tensor(shape, dtype, values, null);
    }

    private static void checkShape(Shape shape, int length) {
        if (!shape.isFullyDefined())
            throw new IllegalArgumentException("Concrete tensors need a fully defined shape, got " + shape);
        if (shape.toFlatSize() != length)
            throw new IllegalArgumentException("Shape " + shape + " needs " + shape.toFlatSize() + " elements, got " + length);
    }

    private static void normalize(float[] data, DataType dtype) {
        switch (dtype) {
            case INT32 -> {
                for (int i = 0; i < data.length; i++)
                    data[i] = (float) (int) data[i];
            }
            case BOOL -> {
                for (int i = 0; i < data.length; i++)
                    data[i] = data[i] != 0f ? 1f : 0f;
            }
            default -> {
            }
        }
    }

    public Shape shape() {
        return shape;
    }

    public DataType dtype() {
        return dtype;
    }

    public int rank() {
        return shape.rank();
    }

    public int size() {
        return dtype == DataType.STRING ? strings.length : values.length;
    }

    /**
     * Copy of the numeric storage in row-major order.
     */
    public float[] toFloatArray() {
        if (dtype == DataType.STRING)
            throw new IllegalStateException("String tensor has no numeric values");
        return values.clone();
    }

    public String[] toStringArray() {
        if (dtype != DataType.STRING)
            throw new IllegalStateException("Tensor of dtype " + dtype + " has no string values");
        return strings.clone();
    }

    public float get(int... indices) {
        if (dtype == DataType.STRING)
            throw new IllegalStateException("String tensor has no numeric values");
        return values[flatIndex(indices)];
    }

    public String getString(int... indices) {
        if (dtype != DataType.STRING)
            throw new IllegalStateException("Tensor of dtype " + dtype + " has no string values");
        return strings[flatIndex(indices)];
    }

    private int flatIndex(int[] indices) {
        if (indices.length != shape.rank())
            throw new IllegalArgumentException("Expected " + shape.rank() + " indices, got " + indices.length);
        int index = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape.dim(i))
                throw new IndexOutOfBoundsException("Index " + indices[i] + " out of bounds for axis " + i + " of " + shape);
            index = index * shape.dim(i) + indices[i];
        }
        return index;
    }

    /**
     * Same elements viewed under a different shape with the same flat size.
     */
    public Tensor reshape(Shape newShape) {
        checkShape(newShape, size());
        return new Tensor(newShape, dtype, values, strings);
    }

    /**
     * Converts the elements to {@code target}. Numeric and boolean types convert into each other
     * (float to int truncates toward zero, anything non-zero becomes true).
     *
     * @throws IllegalArgumentException if no conversion between the types exists
     */
    public Tensor cast(DataType target) {
        if (target == dtype)
            return this;
        if (!dtype.canCastTo(target))
            throw new IllegalArgumentException("Cannot cast " + dtype + " tensor to " + target);
        float[] copy = values.clone();
        normalize(copy, target);
        return new Tensor(shape, target, copy, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Tensor other))
            return false;
        return dtype == other.dtype && shape.equals(other.shape)
            && Arrays.equals(values, other.values) && Arrays.equals(strings, other.strings);
    }

    @Override
    public int hashCode() {
        int result = shape.hashCode();
        result = 31 * result + dtype.hashCode();
        result = 31 * result + Arrays.hashCode(values);
        return 31 * result + Arrays.hashCode(strings);
    }

    @Override
    public String toString() {
        String data = dtype == DataType.STRING ? Arrays.toString(strings) : Arrays.toString(values);
        if (data.length() > 80)
            data = data.substring(0, 77) + "...";
        return "Tensor{" + shape + ", " + dtype + ", " + data + "}";
    }
}
