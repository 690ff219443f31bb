package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;

import java.util.List;
import java.util.Map;

/**
 * Returns its input unchanged.
 */
public class Identity extends Layer {

    public Identity(String name) {
        super(name);
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        return List.of(singleShape(inputShapes));
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        return List.of(singleInput(inputs, getName()));
    }

    public static Identity fromConfig(Map<String, Object> config) {
        return new Identity(ConfigValues.string(config, "name"));
    }
}
