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
 * Repeats a {@code [batch, features]} input {@code n} times: the output has shape
 * {@code [batch, n, features]}.
 */
public class RepeatVector extends Layer {

    private final int n;

    public RepeatVector(String name, int n) {
        super(name);
        if (n <= 0)
            throw new ConfigurationException("RepeatVector needs a positive repeat count, got " + n);
        this.n = n;
    }

    @Override
    protected void validateInputShapes(List<Shape> inputShapes) {
        if (singleShape(inputShapes).rank() != 2)
            throw new IllegalArgumentException("RepeatVector needs a rank 2 input, got " + inputShapes.get(0));
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        Shape input = singleShape(inputShapes);
        return List.of(Shape.of(input.dim(0), n, input.dim(1)));
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        Tensor x = singleInput(inputs, getName());
        int batch = x.shape().dim(0);
        int features = x.shape().dim(1);
        float[] in = x.toFloatArray();
        float[] out = new float[batch * n * features];
        for (int b = 0; b < batch; b++) {
            for (int r = 0; r < n; r++)
                System.arraycopy(in, b * features, out, (b * n + r) * features, features);
        }
        return List.of(Tensor.of(Shape.of(batch, n, features), x.dtype(), out));
    }

    public int getN() {
        return n;
    }

    @Override
    public Map<String, Object> getConfig() {
        Map<String, Object> config = super.getConfig();
        config.put("n", n);
        return config;
    }

    public static RepeatVector fromConfig(Map<String, Object> config) {
        return new RepeatVector(ConfigValues.string(config, "name"), ConfigValues.integer(config, "n"));
    }
}
