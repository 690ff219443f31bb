package dev.neuronic.graph.layers;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.activators.Activator;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Layer;

import java.util.List;
import java.util.Map;

/**
 * Applies an activator to its input. Row-wise activators (softmax) normalize over the last axis.
 */
public class Activation extends Layer {

    private final Activator activator;

    public Activation(String name, Activator activator) {
        super(name);
        if (activator == null)
            throw new ConfigurationException("Activation layer '" + name + "' needs an activator");
        this.activator = activator;
    }

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        return List.of(singleShape(inputShapes));
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args) {
        Tensor x = singleInput(inputs, getName());
        float[] values = x.toFloatArray();
        int rowLength = x.rank() == 0 ? 1 : x.shape().last();
        if (values.length > 0)
            activator.activateRows(values, values, rowLength);
        return List.of(Tensor.wrap(x.shape(), DataType.FLOAT32, values));
    }

    @Override
    protected DataType computeOutputDtype(List<DataType> inputTypes, int outputIndex) {
        return DataType.FLOAT32;
    }

    public Activator getActivator() {
        return activator;
    }

    @Override
    public Map<String, Object> getConfig() {
        Map<String, Object> config = super.getConfig();
        ActivationConfig.write(activator, config);
        return config;
    }

    public static Activation fromConfig(Map<String, Object> config) {
        return new Activation(ConfigValues.string(config, "name"), ActivationConfig.read(config));
    }
}
