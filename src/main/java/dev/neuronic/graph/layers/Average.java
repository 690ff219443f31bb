package dev.neuronic.graph.layers;

import dev.neuronic.graph.config.ConfigValues;

import java.util.Map;

/**
 * Element-wise mean of the inputs.
 */
public class Average extends Merge {

    public Average(String name) {
        super(name);
    }

    @Override
    protected float merge(float a, float b) {
        return a + b;
    }

    @Override
    protected void finish(float[] values, int inputCount) {
        float scale = 1.0f / inputCount;
        for (int i = 0; i < values.length; i++)
            values[i] *= scale;
    }

    public static Average fromConfig(Map<String, Object> config) {
        return new Average(ConfigValues.string(config, "name"));
    }
}
