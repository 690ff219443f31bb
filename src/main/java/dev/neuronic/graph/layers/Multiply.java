package dev.neuronic.graph.layers;

import dev.neuronic.graph.config.ConfigValues;

import java.util.Map;

/**
 * Element-wise product of the inputs.
 */
public class Multiply extends Merge {

    public Multiply(String name) {
        super(name);
    }

    @Override
    protected float merge(float a, float b) {
        return a * b;
    }

    public static Multiply fromConfig(Map<String, Object> config) {
        return new Multiply(ConfigValues.string(config, "name"));
    }
}
