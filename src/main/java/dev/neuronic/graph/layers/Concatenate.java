package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Joins two or more inputs along {@code axis}. All other axes must agree; a negative axis counts
 * from the end.
 */
public class Concatenate extends Layer {

    public static final int LAST_AXIS = -1;

    private final int axis;

    public Concatenate(String name) {
        this(name, LAST_AXIS);
    }

    public Concatenate(String name, int axis) {
        super(name);
        this.axis = axis;
    }

    @Override
    protected void validateInputShapes(List<Shape> inputShapes) {
        computeOutputShape(inputShapes);
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        if (inputShapes.size() < 2)
            throw new IllegalArgumentException("Concatenate should be called on a list of at least 2 inputs, got "
                + inputShapes.size());
        int rank = inputShapes.get(0).rank();
        int concatAxis = normalizeAxis(rank);
        int[] dims = inputShapes.get(0).dims();
        for (int i = 1; i < inputShapes.size(); i++) {
            Shape shape = inputShapes.get(i);
            if (shape.rank() != rank)
                throw new IllegalArgumentException("Concatenate needs inputs of equal rank, got " + inputShapes);
            for (int d = 0; d < rank; d++) {
                if (d == concatAxis) {
                    dims[d] = dims[d] == Shape.UNKNOWN || !shape.isKnown(d) ? Shape.UNKNOWN : dims[d] + shape.dim(d);
                } else if (dims[d] == Shape.UNKNOWN) {
                    dims[d] = shape.dim(d);
                } else if (shape.isKnown(d) && shape.dim(d) != dims[d]) {
                    throw new IllegalArgumentException("Concatenate needs matching shapes except along axis "
                        + axis + ", got " + inputShapes);
                }
            }
        }
        return List.of(Shape.of(dims));
    }

    private int normalizeAxis(int rank) {
        int normalized = axis < 0 ? rank + axis : axis;
        if (normalized < 0 || normalized >= rank)
            throw new IllegalArgumentException("Axis " + axis + " is out of range for inputs of rank " + rank);
        return normalized;
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        List<Shape> shapes = new ArrayList<>(inputs.size());
        for (Tensor input : inputs)
            shapes.add(input.shape());
        Shape outShape = computeOutputShape(shapes).get(0);
        int concatAxis = normalizeAxis(outShape.rank());

        int outer = 1;
        for (int d = 0; d < concatAxis; d++)
            outer *= outShape.dim(d);
        int inner = outShape.flatSizeFrom(concatAxis + 1);
        int outChunk = outShape.dim(concatAxis) * inner;

        float[] out = new float[outShape.toFlatSize()];
        int columnOffset = 0;
        for (Tensor input : inputs) {
            float[] values = input.toFloatArray();
            int chunk = input.shape().dim(concatAxis) * inner;
            for (int o = 0; o < outer; o++)
                System.arraycopy(values, o * chunk, out, o * outChunk + columnOffset, chunk);
            columnOffset += chunk;
        }
        return List.of(Tensor.of(outShape, inputs.get(0).dtype(), out));
    }

    public int getAxis() {
        return axis;
    }

    @Override
    public Map<String, Object> getConfig() {
        Map<String, Object> config = super.getConfig();
        config.put("axis", axis);
        return config;
    }

    public static Concatenate fromConfig(Map<String, Object> config) {
        return new Concatenate(ConfigValues.string(config, "name"), ConfigValues.integer(config, "axis", LAST_AXIS));
    }
}
