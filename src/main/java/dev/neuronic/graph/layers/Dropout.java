package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.math.FastRandom;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dropout layer for regularization during training.
 *
 * <p><b>What it does:</b> in training mode each element is zeroed with probability {@code rate}
 * and the survivors are scaled by {@code 1 / (1 - rate)} so the expected sum is unchanged. In
 * inference mode the input passes through untouched. A {@code training} call argument on the
 * node overrides the executor's mode.
 *
 * <p>With a seed, the n-th training-mode call of the layer always drops the same elements.
 */
public class Dropout extends Layer {

    private final float rate;
    private final Long seed;
    private final AtomicLong calls = new AtomicLong();

    public Dropout(String name, float rate) {
        this(name, rate, null);
    }

    public Dropout(String name, float rate, Long seed) {
        super(name);
        if (rate < 0 || rate >= 1)
            throw new ConfigurationException("Dropout rate must be in [0, 1), got: " + rate);
        this.rate = rate;
        this.seed = seed;
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        return List.of(singleShape(inputShapes));
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        Tensor x = singleInput(inputs, getName());
        if (!isTraining(training, args) || rate == 0f)
            return List.of(x);

        FastRandom random = FastRandom.forCall(seed, calls.getAndIncrement());
        float scale = 1.0f / (1.0f - rate);
        float[] values = x.toFloatArray();
        for (int i = 0; i < values.length; i++)
            values[i] = random.nextFloat() < rate ? 0f : values[i] * scale;
        return List.of(Tensor.of(x.shape(), x.dtype(), values));
    }

    public float getRate() {
        return rate;
    }

    @Override
    public Map<String, Object> getConfig() {
        Map<String, Object> config = super.getConfig();
        config.put("rate", rate);
        if (seed != null)
            config.put("seed", seed);
        return config;
    }

    public static Dropout fromConfig(Map<String, Object> config) {
        return new Dropout(ConfigValues.string(config, "name"), ConfigValues.decimal(config, "rate"),
            ConfigValues.seed(config, "seed"));
    }
}
