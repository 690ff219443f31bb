package dev.neuronic.graph.models;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.NameScope;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.topology.Graph;
import dev.neuronic.graph.topology.Inputs;
import dev.neuronic.graph.topology.Layer;
import dev.neuronic.graph.topology.SymbolicValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Graph} in which every layer consumes the previous layer's output.
 *
 * <p>Each {@link #add(Layer)} applies the layer right away, so a layer that cannot accept the
 * current shape fails at that call rather than at {@link #build()}.
 */
public class SequentialBuilder {

    private final NameScope scope;
    private final List<Layer> layers = new ArrayList<>();
    private String name;
    private SymbolicValue input;
    private SymbolicValue current;

    SequentialBuilder(NameScope scope) {
        if (scope == null)
            throw new IllegalArgumentException("scope must not be null");
        this.scope = scope;
    }

    public SequentialBuilder name(String name) {
        scope.reserve(name);
        this.name = name;
        return this;
    }

    /**
     * Sets the input shape, including the batch axis, e.g. {@code Shape.batched(784)}.
     */
    public SequentialBuilder input(Shape shape) {
        return input(shape, DataType.FLOAT32);
    }

    public SequentialBuilder input(Shape shape, DataType dtype) {
        if (input != null)
            throw new ConfigurationException("Input already set to " + input.getShape());
        this.input = Inputs.input(shape, dtype, scope);
        this.current = input;
        return this;
    }

    /**
     * @throws ConfigurationException if no input was set or the layer rejects the current shape
     */
    public SequentialBuilder add(Layer layer) {
        if (current == null)
            throw new ConfigurationException("Call input() before adding layers");
        current = layer.apply(current);
        layers.add(layer);
        return this;
    }

    /**
     * Shape the next added layer will receive.
     */
    public Shape currentShape() {
        if (current == null)
            throw new ConfigurationException("Call input() first");
        return current.getShape();
    }

    public Graph build() {
        if (input == null)
            throw new ConfigurationException("Sequential model needs an input; call input() first");
        if (layers.isEmpty())
            throw new ConfigurationException("Sequential model needs at least one layer");
        String graphName = name != null ? name : scope.uniqueName("sequential");
        return new Graph(graphName, List.of(input), List.of(current));
    }
}
