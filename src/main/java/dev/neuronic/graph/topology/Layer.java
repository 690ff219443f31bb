package dev.neuronic.graph.topology;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.WeightInitStrategy;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.math.FastRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, possibly stateful transformation from tensors to tensors.
 *
 * <p><b>Symbolic use:</b> {@link #apply(List, CallArguments)} connects the layer into a graph. The
 * first call builds the layer for the input shapes (creating its weights); every call records a
 * new {@link Node} and returns fresh {@link SymbolicValue}s. A layer may be applied any number of
 * times; all calls share the same weights.
 *
 * <p><b>Concrete use:</b> {@link #forward(List, boolean, CallArguments)} computes output tensors.
 * It is invoked by the graph executor once per node and must be a pure function of its
 * arguments and the layer's weights.
 *
 * <p>Subclasses implement {@link #computeOutputShape(List)} and {@code forward}, and create
 * weights in {@link #onBuild(List)} through {@link #addWeight}.
 */
public abstract class Layer {

    private static final Logger LOG = LoggerFactory.getLogger(Layer.class);

    /**
     * Observes every concrete invocation of a layer.
     */
    @FunctionalInterface
    public interface CallHook {
        void onCall(List<Tensor> inputs, CallArguments args);
    }

    private final String name;
    private final DataType dtype;
    private final List<Node> inboundNodes = new ArrayList<>();
    private final Map<String, Parameter> parameters = new LinkedHashMap<>();
    private boolean trainable = true;
    private volatile boolean built;
    private boolean building;
    private List<Shape> builtInputShapes;
    private volatile CallHook callHook;

    /**
     * @param name  unique name within the graphs that will contain this layer
     * @param dtype element type of the layer's outputs and weights, or {@code null} to follow the
     *              first input's type
     */
    protected Layer(String name, DataType dtype) {
        if (name == null || name.isEmpty())
            throw new ConfigurationException("Layer name must not be empty");
        this.name = name;
        this.dtype = dtype;
    }

    protected Layer(String name) {
        this(name, null);
    }

    // ===============================
    // SYMBOLIC INVOCATION
    // ===============================

    /**
     * Connects this layer to the given inputs, recording a new node.
     *
     * @throws ConfigurationException if the input shapes are not acceptable, or differ from the
     *                                shapes this layer was built for
     */
    public final synchronized List<SymbolicValue> apply(List<SymbolicValue> inputs, CallArguments args) {
        if (inputs == null || inputs.isEmpty())
            throw new ConfigurationException("Layer '" + name + "' needs at least one input");
        CallArguments callArgs = args == null ? CallArguments.empty() : args;

        List<Shape> inputShapes = new ArrayList<>(inputs.size());
        List<DataType> inputTypes = new ArrayList<>(inputs.size());
        for (SymbolicValue input : inputs) {
            if (input == null)
                throw new ConfigurationException("Layer '" + name + "' received a null input");
            inputShapes.add(input.getShape());
            inputTypes.add(input.getDtype());
        }

        build(inputShapes);
        List<Shape> outputShapes = inferOutputShapes(inputShapes);

        Node node = new Node(this, inboundNodes.size(), inputs, callArgs);
        String baseName = node.getNodeIndex() == 0 ? name : name + "/" + node.getNodeIndex();
        List<SymbolicValue> outputs = new ArrayList<>(outputShapes.size());
        for (int i = 0; i < outputShapes.size(); i++) {
            String valueName = outputShapes.size() == 1 ? baseName : baseName + ":" + i;
            outputs.add(new SymbolicValue(valueName, outputShapes.get(i), computeOutputDtype(inputTypes, i), node, i));
        }
        node.attachOutputs(outputs);
        inboundNodes.add(node);
        return Collections.unmodifiableList(outputs);
    }

    public final List<SymbolicValue> apply(List<SymbolicValue> inputs) {
        return apply(inputs, CallArguments.empty());
    }

    /**
     * Single-input, single-output invocation.
     */
    public final SymbolicValue apply(SymbolicValue input) {
        return single(apply(List.of(input), CallArguments.empty()));
    }

    public final SymbolicValue apply(SymbolicValue input, CallArguments args) {
        return single(apply(List.of(input), args));
    }

    /**
     * Multi-input, single-output invocation, e.g. for merge layers.
     */
    public final SymbolicValue apply(SymbolicValue first, SymbolicValue second, SymbolicValue... rest) {
        List<SymbolicValue> inputs = new ArrayList<>(rest.length + 2);
        inputs.add(first);
        inputs.add(second);
        Collections.addAll(inputs, rest);
        return single(apply(inputs, CallArguments.empty()));
    }

    private SymbolicValue single(List<SymbolicValue> outputs) {
        if (outputs.size() != 1)
            throw new ConfigurationException("Layer '" + name + "' has " + outputs.size() + " outputs; use apply(List) instead");
        return outputs.get(0);
    }

    private List<Shape> inferOutputShapes(List<Shape> inputShapes) {
        List<Shape> outputShapes;
        try {
            outputShapes = computeOutputShape(inputShapes);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ConfigurationException("Layer '" + name + "' cannot accept inputs " + inputShapes + ": " + e.getMessage(), e);
        }
        if (outputShapes == null || outputShapes.isEmpty())
            throw new ConfigurationException("Layer '" + name + "' declared no outputs");
        return outputShapes;
    }

    // ===============================
    // BUILD
    // ===============================

    /**
     * Fixes the layer's weights for the given input shapes. Idempotent: once built, later calls
     * only verify that the shapes are compatible with the first build.
     *
     * @throws ConfigurationException on incompatible shapes
     */
    public final synchronized void build(List<Shape> inputShapes) {
        if (built) {
            checkInputCompatibility(builtInputShapes, inputShapes);
            return;
        }
        building = true;
        try {
            validateInputShapes(inputShapes);
            onBuild(inputShapes);
        } catch (IllegalArgumentException | IllegalStateException e) {
            parameters.clear();
            throw new ConfigurationException("Layer '" + name + "' cannot be built for " + inputShapes + ": " + e.getMessage(), e);
        } finally {
            building = false;
        }
        builtInputShapes = List.copyOf(inputShapes);
        built = true;
        if (LOG.isDebugEnabled())
            LOG.debug("Built layer '{}' ({}) for inputs {} with {} parameters", name, getClassName(), inputShapes, countParams());
    }

    /**
     * Marks the layer as built without running {@link #onBuild}, for layers whose structure is
     * complete at construction time.
     */
    protected final synchronized void markBuilt(List<Shape> inputShapes) {
        builtInputShapes = List.copyOf(inputShapes);
        built = true;
    }

    /**
     * Creates the layer's weights. Called once, on the first invocation.
     */
    protected void onBuild(List<Shape> inputShapes) {
    }

    /**
     * Rejects input shapes this layer can never accept. The default accepts anything.
     *
     * @throws IllegalArgumentException if the shapes are not acceptable
     */
    protected void validateInputShapes(List<Shape> inputShapes) {
    }

    /**
     * Verifies that a re-invocation is compatible with the shapes the layer was built for:
     * same number of inputs, same ranks, and equal dimensions wherever both are known. Axis 0 is
     * the batch axis and is not compared for inputs of rank 2 or more.
     */
    protected void checkInputCompatibility(List<Shape> builtShapes, List<Shape> inputShapes) {
        if (builtShapes.size() != inputShapes.size())
            throw new ConfigurationException("Layer '" + name + "' was built for " + builtShapes.size()
                + " inputs but was called with " + inputShapes.size());
        for (int i = 0; i < builtShapes.size(); i++) {
            Shape expected = builtShapes.get(i);
            Shape actual = inputShapes.get(i);
            boolean compatible = expected.rank() == actual.rank();
            int first = expected.rank() >= 2 ? 1 : 0;
            for (int d = first; compatible && d < expected.rank(); d++) {
                if (expected.isKnown(d) && actual.isKnown(d) && expected.dim(d) != actual.dim(d))
                    compatible = false;
            }
            if (!compatible)
                throw new ConfigurationException("Layer '" + name + "' was built for input " + i + " of shape "
                    + expected + " and cannot be called with shape " + actual);
        }
    }

    /**
     * Registers a weight. Only allowed while the layer is being built.
     */
    protected final Parameter addWeight(String weightName, Shape shape, WeightInitStrategy initializer,
                                        FastRandom random, boolean trainable) {
        if (!building)
            throw new ConfigurationException("Layer '" + name + "' can only add weights while building; its weights are fixed");
        if (parameters.containsKey(weightName))
            throw new ConfigurationException("Layer '" + name + "' already has a weight named '" + weightName + "'");
        DataType weightType = dtype == null ? DataType.FLOAT32 : dtype;
        Tensor initial = Tensor.wrap(shape, weightType, initializer.initialize(shape, random));
        Parameter parameter = new Parameter(name, weightName, initial, trainable);
        parameters.put(weightName, parameter);
        return parameter;
    }

    // ===============================
    // CONCRETE INVOCATION
    // ===============================

    /**
     * Output shapes for the given input shapes, without computing anything.
     *
     * @throws IllegalArgumentException if the shapes are not acceptable
     */
    public abstract List<Shape> computeOutputShape(List<Shape> inputShapes);

    /**
     * Computes the outputs of one invocation.
     *
     * @param training whether the surrounding execution runs in training mode
     * @param args     the non-tensor arguments recorded with the node
     */
    public abstract List<Tensor> forward(List<Tensor> inputs, boolean training, CallArguments args);

    /**
     * Runs the call hook, if any, and then {@link #forward}.
     */
    public final List<Tensor> call(List<Tensor> inputs, boolean training, CallArguments args) {
        CallHook hook = callHook;
        if (hook != null)
            hook.onCall(inputs, args);
        return forward(inputs, training, args);
    }

    /**
     * Output type for output {@code outputIndex}: the layer's own type if it declares one,
     * otherwise the first input's type.
     */
    protected DataType computeOutputDtype(List<DataType> inputTypes, int outputIndex) {
        if (dtype != null)
            return dtype;
        return inputTypes.isEmpty() ? DataType.FLOAT32 : inputTypes.get(0);
    }

    /**
     * The effective training flag for one call: an explicit {@code training} call argument wins
     * over the executor's mode.
     */
    protected static boolean isTraining(boolean training, CallArguments args) {
        return args.training().orElse(training);
    }

    protected static Tensor singleInput(List<Tensor> inputs, String layerName) {
        if (inputs.size() != 1)
            throw new IllegalArgumentException("Layer '" + layerName + "' expects exactly one input, got " + inputs.size());
        return inputs.get(0);
    }

    protected static Shape singleShape(List<Shape> shapes) {
        if (shapes.size() != 1)
            throw new IllegalArgumentException("Expected exactly one input shape, got " + shapes.size());
        return shapes.get(0);
    }

    // ===============================
    // WEIGHTS
    // ===============================

    /**
     * Weight names, shapes and types in the order {@link #setWeights} expects values.
     * Empty until the layer is built.
     */
    public List<WeightDescriptor> getWeightDescriptors() {
        List<WeightDescriptor> descriptors = new ArrayList<>(parameters.size());
        for (Parameter parameter : parameters.values())
            descriptors.add(parameter.describe());
        return descriptors;
    }

    public List<Tensor> getWeights() {
        List<Tensor> weights = new ArrayList<>(parameters.size());
        for (Parameter parameter : parameters.values())
            weights.add(parameter.getValue());
        return weights;
    }

    /**
     * Assigns all weights at once, in {@link #getWeightDescriptors()} order.
     *
     * Every value is checked before any is assigned, so a rejected call changes nothing.
     *
     * @throws ConfigurationException if the count or any shape or dtype does not match
     */
    public void setWeights(List<Tensor> weights) {
        if (weights.size() != parameters.size())
            throw new ConfigurationException("Layer '" + name + "' expects " + parameters.size()
                + " weight values but got " + weights.size());
        int i = 0;
        for (Parameter parameter : parameters.values())
            parameter.checkAssignable(weights.get(i++));
        i = 0;
        for (Parameter parameter : parameters.values())
            parameter.assign(weights.get(i++));
    }

    public List<Parameter> getParameters() {
        return List.copyOf(parameters.values());
    }

    protected final Parameter getParameter(String weightName) {
        Parameter parameter = parameters.get(weightName);
        if (parameter == null)
            throw new IllegalStateException("Layer '" + name + "' has no weight '" + weightName + "'; was it built?");
        return parameter;
    }

    public int countParams() {
        int count = 0;
        for (Parameter parameter : parameters.values())
            count += parameter.size();
        return count;
    }

    // ===============================
    // CONFIGURATION AND STATE
    // ===============================

    /**
     * Constructor arguments needed to recreate an equivalent layer. Subclasses add their own
     * entries to the map returned by {@code super.getConfig()}.
     */
    public Map<String, Object> getConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("name", name);
        config.put("trainable", trainable);
        if (dtype != null)
            config.put("dtype", dtype.configName());
        return config;
    }

    /**
     * Type tag used by {@code LayerRegistry} to recreate this layer.
     */
    public String getClassName() {
        return getClass().getSimpleName();
    }

    public String getName() {
        return name;
    }

    public DataType getDtype() {
        return dtype;
    }

    public boolean isBuilt() {
        return built;
    }

    public List<Shape> getBuiltInputShapes() {
        return builtInputShapes == null ? List.of() : builtInputShapes;
    }

    public boolean isTrainable() {
        return trainable;
    }

    public void setTrainable(boolean trainable) {
        this.trainable = trainable;
    }

    /**
     * Every node recorded for this layer, in invocation order.
     */
    public synchronized List<Node> getInboundNodes() {
        return List.copyOf(inboundNodes);
    }

    public synchronized Node getInboundNode(int nodeIndex) {
        if (nodeIndex < 0 || nodeIndex >= inboundNodes.size())
            throw new IllegalArgumentException("Layer '" + name + "' has no node " + nodeIndex
                + " (it has been called " + inboundNodes.size() + " times)");
        return inboundNodes.get(nodeIndex);
    }

    public void setCallHook(CallHook hook) {
        this.callHook = hook;
    }

    public void clearCallHook() {
        this.callHook = null;
    }

    @Override
    public String toString() {
        return getClassName() + "{" + name + "}";
    }
}
