package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;

import java.util.List;

/**
 * Base of the element-wise merge layers. Takes two or more inputs and folds them pairwise with
 * {@link #merge(float, float)}.
 *
 * <p>Shapes broadcast the usual way: axes are aligned from the right, missing leading axes count
 * as 1, and an axis of size 1 stretches to match the other input.
 */
public abstract class Merge extends Layer {

    protected Merge(String name) {
        super(name);
    }

    protected abstract float merge(float a, float b);

    /**
     * Post-processing of the folded values, e.g. dividing by the input count. Identity by default.
     */
    protected void finish(float[] values, int inputCount) {
    }

    @Override
    protected void validateInputShapes(List<Shape> inputShapes) {
        if (inputShapes.size() < 2)
            throw new IllegalArgumentException("A merge layer should be called on a list of at least 2 inputs, got "
                + inputShapes.size());
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        validateInputShapes(inputShapes);
        Shape result = inputShapes.get(0);
        for (int i = 1; i < inputShapes.size(); i++)
            result = broadcast(result, inputShapes.get(i));
        return List.of(result);
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        if (inputs.size() < 2)
            throw new IllegalArgumentException("Merge layer '" + getName() + "' needs at least 2 inputs, got " + inputs.size());
        Shape shape = inputs.get(0).shape();
        float[] acc = inputs.get(0).toFloatArray();
        for (int i = 1; i < inputs.size(); i++) {
            Tensor next = inputs.get(i);
            Shape merged = broadcast(shape, next.shape());
            acc = apply(acc, shape, next.toFloatArray(), next.shape(), merged);
            shape = merged;
        }
        finish(acc, inputs.size());
        return List.of(Tensor.of(shape, inputs.get(0).dtype(), acc));
    }

    private float[] apply(float[] a, Shape aShape, float[] b, Shape bShape, Shape out) {
        int size = out.toFlatSize();
        float[] result = new float[size];
        if (aShape.equals(bShape)) {
            for (int i = 0; i < size; i++)
                result[i] = merge(a[i], b[i]);
            return result;
        }

        int rank = out.rank();
        int[] aStrides = broadcastStrides(aShape, out);
        int[] bStrides = broadcastStrides(bShape, out);
        int[] index = new int[rank];
        for (int flat = 0; flat < size; flat++) {
            int aOffset = 0;
            int bOffset = 0;
            for (int d = 0; d < rank; d++) {
                aOffset += index[d] * aStrides[d];
                bOffset += index[d] * bStrides[d];
            }
            result[flat] = merge(a[aOffset], b[bOffset]);
            for (int d = rank - 1; d >= 0; d--) {
                if (++index[d] < out.dim(d))
                    break;
                index[d] = 0;
            }
        }
        return result;
    }

    // Stride 0 on broadcast axes.
    private static int[] broadcastStrides(Shape in, Shape out) {
        int[] strides = new int[out.rank()];
        int offset = out.rank() - in.rank();
        int stride = 1;
        for (int d = in.rank() - 1; d >= 0; d--) {
            strides[d + offset] = in.dim(d) == 1 ? 0 : stride;
            stride *= in.dim(d);
        }
        return strides;
    }

    /**
     * Broadcast result of two shapes.
     *
     * @throws IllegalArgumentException if two known axes differ and neither is 1
     */
    static Shape broadcast(Shape a, Shape b) {
        int rank = Math.max(a.rank(), b.rank());
        int[] dims = new int[rank];
        for (int i = 1; i <= rank; i++) {
            int da = i <= a.rank() ? a.dim(a.rank() - i) : 1;
            int db = i <= b.rank() ? b.dim(b.rank() - i) : 1;
            if (da == 1)
                dims[rank - i] = db;
            else if (db == 1)
                dims[rank - i] = da;
            else if (da == Shape.UNKNOWN)
                dims[rank - i] = db;
            else if (db == Shape.UNKNOWN || da == db)
                dims[rank - i] = da;
            else
                throw new IllegalArgumentException("Operands could not be broadcast together with shapes " + a + " " + b);
        }
        return new Shape(dims);
    }
}
