package dev.neuronic.graph.layers;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.NameScope;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.WeightInitStrategy;
import dev.neuronic.graph.activators.Activator;
import dev.neuronic.graph.activators.LeakyReluActivator;
import dev.neuronic.graph.activators.LinearActivator;
import dev.neuronic.graph.activators.ReluActivator;
import dev.neuronic.graph.activators.SoftmaxActivator;
import dev.neuronic.graph.topology.Graph;
import dev.neuronic.graph.topology.Inputs;
import dev.neuronic.graph.topology.SymbolicValue;

import java.util.List;

/**
 * Convenient factory for all layer types, naming every layer from one {@link NameScope}.
 *
 * <p>Organized by purpose for easy discovery:
 * <ul>
 *   <li>{@code input()} - graph inputs</li>
 *   <li>{@code dense()}, {@code activation()}, ... - single-input layers</li>
 *   <li>{@code add()}, {@code concatenate()}, ... - merge layers</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>{@code
 * Layers layers = new Layers(new NameScope());
 * SymbolicValue x = layers.input(Shape.batched(784));
 * SymbolicValue h = layers.denseRelu(128).apply(x);
 * SymbolicValue y = layers.dense(10, SoftmaxActivator.INSTANCE).apply(h);
 * Graph model = layers.graph(List.of(x), List.of(y));
 * }</pre>
 *
 * <p>Generated names follow the pattern {@code <type>_<n>}, e.g. {@code dense_1}, {@code dense_2}.
 * Explicitly named layers reserve their name in the scope.
 */
public final class Layers {

    private final NameScope scope;

    public Layers(NameScope scope) {
        if (scope == null)
            throw new IllegalArgumentException("scope must not be null");
        this.scope = scope;
    }

    public NameScope getScope() {
        return scope;
    }

    private String name(String base) {
        return scope.uniqueName(base);
    }

    private String reserve(String name) {
        scope.reserve(name);
        return name;
    }

    // ===============================
    // INPUTS
    // ===============================

    public SymbolicValue input(Shape shape) {
        return Inputs.input(shape, DataType.FLOAT32, scope);
    }

    public SymbolicValue input(Shape shape, DataType dtype) {
        return Inputs.input(shape, dtype, scope);
    }

    public SymbolicValue input(Shape shape, DataType dtype, String name) {
        return Inputs.input(shape, dtype, reserve(name));
    }

    // ===============================
    // CORE LAYERS
    // ===============================

    /**
     * Fully connected layer without activation, Xavier-initialized kernel and zero bias.
     */
    public Dense dense(int units) {
        return dense(units, LinearActivator.INSTANCE);
    }

    public Dense dense(int units, Activator activator) {
        return new Dense(name("dense"), units, activator);
    }

    /**
     * Fully connected layer with ReLU activation and He initialization.
     *
     * <p><b>When to use:</b> the default choice for hidden layers.
     */
    public Dense denseRelu(int units) {
        return new Dense(name("dense"), units, ReluActivator.INSTANCE, true,
            WeightInitStrategy.HE, WeightInitStrategy.ZEROS, null);
    }

    public Dense denseLeakyRelu(int units, float alpha) {
        return new Dense(name("dense"), units, LeakyReluActivator.create(alpha), true,
            WeightInitStrategy.HE, WeightInitStrategy.ZEROS, null);
    }

    /**
     * Fully connected layer with softmax over the last axis, typically the output of a classifier.
     */
    public Dense denseSoftmax(int units) {
        return dense(units, SoftmaxActivator.INSTANCE);
    }

    /**
     * Fully connected layer with every option spelled out.
     *
     * @param seed seed for the kernel initializer, or {@code null} for a random one
     */
    public Dense dense(int units, Activator activator, boolean useBias, WeightInitStrategy kernelInitializer,
                       WeightInitStrategy biasInitializer, Long seed) {
        return new Dense(name("dense"), units, activator, useBias, kernelInitializer, biasInitializer, seed);
    }

    public Dense dense(String name, int units, Activator activator) {
        return new Dense(reserve(name), units, activator);
    }

    public Activation activation(Activator activator) {
        return new Activation(name("activation"), activator);
    }

    /**
     * Dropout layer for regularization during training.
     *
     * <p><b>What it does:</b> randomly zeroes a fraction of the values in training mode and
     * rescales the rest; passes values through unchanged at inference.
     *
     * @param rate fraction of values to drop, in [0, 1)
     */
    public Dropout dropout(float rate) {
        return new Dropout(name("dropout"), rate);
    }

    public Dropout dropout(float rate, long seed) {
        return new Dropout(name("dropout"), rate, seed);
    }

    public Flatten flatten() {
        return new Flatten(name("flatten"));
    }

    /**
     * @param targetDims dimensions after the batch axis; at most one may be {@link Shape#UNKNOWN}
     */
    public Reshape reshape(int... targetDims) {
        return new Reshape(name("reshape"), Shape.of(targetDims));
    }

    public RepeatVector repeatVector(int n) {
        return new RepeatVector(name("repeat_vector"), n);
    }

    public Identity identity() {
        return new Identity(name("identity"));
    }

    public Identity identity(String name) {
        return new Identity(reserve(name));
    }

    // ===============================
    // MERGE LAYERS
    // ===============================

    public Add add() {
        return new Add(name("add"));
    }

    public Multiply multiply() {
        return new Multiply(name("multiply"));
    }

    public Average average() {
        return new Average(name("average"));
    }

    public Maximum maximum() {
        return new Maximum(name("maximum"));
    }

    public Minimum minimum() {
        return new Minimum(name("minimum"));
    }

    public Concatenate concatenate() {
        return new Concatenate(name("concatenate"));
    }

    public Concatenate concatenate(int axis) {
        return new Concatenate(name("concatenate"), axis);
    }

    // ===============================
    // GRAPHS
    // ===============================

    public Graph graph(List<SymbolicValue> inputs, List<SymbolicValue> outputs) {
        return new Graph(name("graph"), inputs, outputs);
    }

    public Graph graph(String name, List<SymbolicValue> inputs, List<SymbolicValue> outputs) {
        return new Graph(reserve(name), inputs, outputs);
    }
}
