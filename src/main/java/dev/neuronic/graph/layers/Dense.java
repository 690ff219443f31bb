package dev.neuronic.graph.layers;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.WeightInitStrategy;
import dev.neuronic.graph.activators.Activator;
import dev.neuronic.graph.activators.LinearActivator;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.math.FastRandom;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;
import dev.neuronic.graph.topology.Parameter;

import java.util.List;
import java.util.Map;

/**
 * Fully connected layer: {@code output = activation(input · kernel + bias)} over the last axis.
 *
 * <p>Input shape {@code [..., inputDim]}, output shape {@code [..., units]}. The kernel has shape
 * {@code [inputDim, units]} and is created when the layer is first applied, so the input dimension
 * never needs to be declared up front.
 */
public class Dense extends Layer {

    public static final String KERNEL = "kernel";
    public static final String BIAS = "bias";

    private final int units;
    private final Activator activator;
    private final boolean useBias;
    private final WeightInitStrategy kernelInitializer;
    private final WeightInitStrategy biasInitializer;
    private final Long seed;

    private Parameter kernel;
    private Parameter bias;

    public Dense(String name, int units, Activator activator) {
        this(name, units, activator, true, WeightInitStrategy.XAVIER, WeightInitStrategy.ZEROS, null);
    }

    /**
     * @param seed seed for the kernel initializer, or {@code null} for a random one
     */
    public Dense(String name, int units, Activator activator, boolean useBias,
                 WeightInitStrategy kernelInitializer, WeightInitStrategy biasInitializer, Long seed) {
        super(name);
        if (units <= 0)
            throw new ConfigurationException("Dense layer '" + name + "' needs a positive number of units, got " + units);
        if (kernelInitializer == null || biasInitializer == null)
            throw new ConfigurationException("Dense layer '" + name + "' needs kernel and bias initializers");
        this.units = units;
        this.activator = activator == null ? LinearActivator.INSTANCE : activator;
        this.useBias = useBias;
        this.kernelInitializer = kernelInitializer;
        this.biasInitializer = biasInitializer;
        this.seed = seed;
    }

    @Override
    protected void validateInputShapes(List<Shape> inputShapes) {
        Shape input = singleShape(inputShapes);
        if (input.rank() < 1 || !input.isKnown(input.rank() - 1) || input.last() == 0)
            throw new IllegalArgumentException("Dense needs an input with a known, non-zero last dimension, got " + input);
    }

    @Override
    protected void onBuild(List<Shape> inputShapes) {
        int inputDim = inputShapes.get(0).last();
        FastRandom random = seed == null ? new FastRandom() : new FastRandom(seed);
        kernel = addWeight(KERNEL, Shape.of(inputDim, units), kernelInitializer, random, true);
        if (useBias)
            bias = addWeight(BIAS, Shape.vector(units), biasInitializer, random, true);
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        Shape input = singleShape(inputShapes);
        return List.of(input.withDim(input.rank() - 1, units));
    }

    @Override
    protected DataType computeOutputDtype(List<DataType> inputTypes, int outputIndex) {
        return DataType.FLOAT32;
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        Tensor x = singleInput(inputs, getName());
        int inputDim = kernel.getShape().dim(0);
        if (x.rank() < 1 || x.shape().last() != inputDim)
            throw new IllegalArgumentException("Dense layer '" + getName() + "' expects last dimension "
                + inputDim + ", got input of shape " + x.shape());

        float[] in = x.toFloatArray();
        float[] w = kernel.getValue().toFloatArray();
        int rows = in.length / inputDim;
        float[] out = new float[rows * units];

        for (int r = 0; r < rows; r++) {
            int inOffset = r * inputDim;
            int outOffset = r * units;
            for (int k = 0; k < inputDim; k++) {
                float a = in[inOffset + k];
                if (a == 0f)
                    continue;
                int wOffset = k * units;
                for (int u = 0; u < units; u++)
                    out[outOffset + u] += a * w[wOffset + u];
            }
        }

        if (useBias) {
            float[] b = bias.getValue().toFloatArray();
            for (int r = 0; r < rows; r++) {
                for (int u = 0; u < units; u++)
                    out[r * units + u] += b[u];
            }
        }

        activator.activateRows(out, out, units);
        return List.of(Tensor.wrap(x.shape().withDim(x.rank() - 1, units), DataType.FLOAT32, out));
    }

    public int getUnits() {
        return units;
    }

    public Activator getActivator() {
        return activator;
    }

    public boolean usesBias() {
        return useBias;
    }

    @Override
    public Map<String, Object> getConfig() {
        Map<String, Object> config = super.getConfig();
        config.put("units", units);
        ActivationConfig.write(activator, config);
        config.put("useBias", useBias);
        config.put("kernelInitializer", kernelInitializer.configName());
        config.put("biasInitializer", biasInitializer.configName());
        if (seed != null)
            config.put("seed", seed);
        return config;
    }

    public static Dense fromConfig(Map<String, Object> config) {
        return new Dense(
            ConfigValues.string(config, "name"),
            ConfigValues.integer(config, "units"),
            ActivationConfig.read(config),
            ConfigValues.bool(config, "useBias", true),
            WeightInitStrategy.fromConfigName(ConfigValues.string(config, "kernelInitializer", "xavier")),
            WeightInitStrategy.fromConfigName(ConfigValues.string(config, "biasInitializer", "zeros")),
            ConfigValues.seed(config, "seed"));
    }
}
