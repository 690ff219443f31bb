package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;

import java.util.List;
import java.util.Map;

/**
 * Collapses every axis after the first: {@code [batch, d1, d2, ...]} becomes
 * {@code [batch, d1 * d2 * ...]}.
 */
public class Flatten extends Layer {

    public Flatten(String name) {
        super(name);
    }

    @Override
    protected void validateInputShapes(List<Shape> inputShapes) {
        if (singleShape(inputShapes).rank() < 1)
            throw new IllegalArgumentException("Flatten needs an input of rank 1 or more");
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        Shape input = singleShape(inputShapes);
        return List.of(Shape.of(input.dim(0), input.flatSizeFrom(1)));
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        Tensor x = singleInput(inputs, getName());
        return List.of(x.reshape(Shape.of(x.shape().dim(0), x.shape().flatSizeFrom(1))));
    }

    public static Flatten fromConfig(Map<String, Object> config) {
        return new Flatten(ConfigValues.string(config, "name"));
    }
}
