package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;

import java.util.List;
import java.util.Map;

/**
 * Reshapes everything after the batch axis to {@code targetShape}. At most one target dimension
 * may be {@link Shape#UNKNOWN}; it is inferred from the number of elements.
 */
public class Reshape extends Layer {

    private final Shape targetShape;

    public Reshape(String name, Shape targetShape) {
        super(name);
        int unknown = 0;
        for (int i = 0; i < targetShape.rank(); i++) {
            if (!targetShape.isKnown(i))
                unknown++;
        }
        if (unknown > 1)
            throw new ConfigurationException("Reshape target " + targetShape + " may contain at most one unknown dimension");
        this.targetShape = targetShape;
    }

    @Override
    protected void validateInputShapes(List<Shape> inputShapes) {
        if (singleShape(inputShapes).rank() < 1)
            throw new IllegalArgumentException("Reshape needs an input of rank 1 or more");
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        Shape input = singleShape(inputShapes);
        int elements = input.flatSizeFrom(1);
        Shape features = elements == Shape.UNKNOWN ? targetShape : fixUnknownDimension(elements);
        return List.of(features.prepend(input.dim(0)));
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        Tensor x = singleInput(inputs, getName());
        Shape features = fixUnknownDimension(x.shape().flatSizeFrom(1));
        return List.of(x.reshape(features.prepend(x.shape().dim(0))));
    }

    /**
     * The target shape with its unknown dimension resolved for {@code elements} values.
     *
     * @throws IllegalArgumentException if the sizes cannot match
     */
    Shape fixUnknownDimension(int elements) {
        int known = 1;
        int unknownAxis = -1;
        for (int i = 0; i < targetShape.rank(); i++) {
            if (targetShape.isKnown(i))
                known *= targetShape.dim(i);
            else
                unknownAxis = i;
        }

        if (unknownAxis < 0) {
            if (known != elements)
                throw new IllegalArgumentException("Total size of new array must be unchanged: cannot reshape "
                    + elements + " elements to " + targetShape);
            return targetShape;
        }
        if (known == 0 || elements % known != 0)
            throw new IllegalArgumentException("Total size of new array must be unchanged: cannot reshape "
                + elements + " elements to " + targetShape);
        return targetShape.withDim(unknownAxis, elements / known);
    }

    public Shape getTargetShape() {
        return targetShape;
    }

    @Override
    public Map<String, Object> getConfig() {
        Map<String, Object> config = super.getConfig();
        config.put("targetShape", ConfigValues.dims(targetShape));
        return config;
    }

    public static Reshape fromConfig(Map<String, Object> config) {
        return new Reshape(ConfigValues.string(config, "name"), ConfigValues.shape(config, "targetShape"));
    }
}
