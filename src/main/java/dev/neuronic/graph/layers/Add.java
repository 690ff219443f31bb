package dev.neuronic.graph.layers;

import dev.neuronic.graph.config.ConfigValues;

import java.util.Map;

/**
 * Element-wise sum of the inputs.
 */
public class Add extends Merge {

    public Add(String name) {
        super(name);
    }

    @Override
    protected float merge(float a, float b) {
        return a + b;
    }

    public static Add fromConfig(Map<String, Object> config) {
        return new Add(ConfigValues.string(config, "name"));
    }
}
