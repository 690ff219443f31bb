package dev.neuronic.graph.layers;

import dev.neuronic.graph.config.ConfigValues;

import java.util.Map;

/**
 * Element-wise minimum of the inputs.
 */
public class Minimum extends Merge {

    public Minimum(String name) {
        super(name);
    }

    @Override
    protected float merge(float a, float b) {
        return Math.min(a, b);
    }

    public static Minimum fromConfig(Map<String, Object> config) {
        return new Minimum(ConfigValues.string(config, "name"));
    }
}
