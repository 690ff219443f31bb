package dev.neuronic.graph.layers;

import dev.neuronic.graph.config.ConfigValues;

import java.util.Map;

/**
 * Element-wise maximum of the inputs.
 */
public class Maximum extends Merge {

    public Maximum(String name) {
        super(name);
    }

    @Override
    protected float merge(float a, float b) {
        return Math.max(a, b);
    }

    public static Maximum fromConfig(Map<String, Object> config) {
        return new Maximum(ConfigValues.string(config, "name"));
    }
}
