package dev.neuronic.graph.topology;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.config.GraphConfig;
import dev.neuronic.graph.config.LayerRegistry;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.errors.CycleDetectedException;
import dev.neuronic.graph.errors.GraphConstructionException;
import dev.neuronic.graph.exec.FeedDict;
import dev.neuronic.graph.exec.GraphExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A directed acyclic graph of layer invocations, captured between declared inputs and outputs.
 *
 * <p><b>Construction:</b> walks producers backwards from the outputs and records every node and
 * layer it reaches. Every producer-less value reached must be a declared input, otherwise the
 * graph is disconnected and construction fails. Declared inputs that no output depends on are
 * allowed but logged. Layer names must be unique within the graph.
 *
 * <p><b>As a layer:</b> a graph can be applied to new symbolic values like any other layer and
 * thereby nested in a larger graph. The nested graph appears there as a single node whose
 * forward pass runs the inner nodes. Its weights are those of its layers, so applying a graph
 * twice shares them.
 *
 * <p>Once constructed a graph is immutable; its layers may still have their weights assigned.
 */
public class Graph extends Layer {

    private static final Logger LOG = LoggerFactory.getLogger(Graph.class);

    public static final String CLASS_NAME = "Graph";

    private final List<SymbolicValue> inputs;
    private final List<SymbolicValue> outputs;
    private final List<Node> nodes;
    private final List<Layer> layers;
    private final Map<String, Layer> layersByName;
    private final Map<Integer, List<Node>> nodesByDepth;
    private final GraphExecutor executor;

    public Graph(String name, List<SymbolicValue> inputs, List<SymbolicValue> outputs) {
        this(name, inputs, outputs, new GraphExecutor());
    }

    /**
     * @param executor used by {@link #predict} and whenever this graph runs nested in another
     * @throws GraphConstructionException if the inputs and outputs do not delimit a valid graph
     * @throws CycleDetectedException     if a value depends on itself
     */
    public Graph(String name, List<SymbolicValue> inputs, List<SymbolicValue> outputs, GraphExecutor executor) {
        super(name);
        if (inputs == null || inputs.isEmpty())
            throw new GraphConstructionException("Graph '" + name + "' needs at least one input");
        if (outputs == null || outputs.isEmpty())
            throw new GraphConstructionException("Graph '" + name + "' needs at least one output");
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.executor = executor;
        checkInputs();

        this.nodes = Collections.unmodifiableList(collectNodes());
        this.layers = Collections.unmodifiableList(collectLayers());
        this.layersByName = indexLayers();
        this.nodesByDepth = Collections.unmodifiableMap(computeDepths());

        List<Shape> inputShapes = new ArrayList<>(this.inputs.size());
        for (SymbolicValue input : this.inputs)
            inputShapes.add(input.getShape());
        markBuilt(inputShapes);
    }

    // ===============================
    // CONSTRUCTION
    // ===============================

    private void checkInputs() {
        Set<SymbolicValue> seen = new HashSet<>();
        for (SymbolicValue input : inputs) {
            if (!input.isGraphInput())
                throw new GraphConstructionException("Graph '" + getName() + "': input '" + input.getName()
                    + "' is produced by layer '" + input.getProducer().getLayer().getName()
                    + "'; graph inputs must be created with Inputs.input");
            if (!seen.add(input))
                throw new GraphConstructionException("Graph '" + getName() + "': input '" + input.getName()
                    + "' is declared more than once");
        }
    }

    /**
     * Reachable nodes, producers first.
     */
    private List<Node> collectNodes() {
        Set<SymbolicValue> declaredInputs = new HashSet<>(inputs);
        Set<SymbolicValue> reachedInputs = new HashSet<>();
        Map<Node, Boolean> finished = new IdentityHashMap<>();
        List<Node> order = new ArrayList<>();

        for (SymbolicValue output : outputs) {
            Node root = resolveProducer(output, declaredInputs, reachedInputs);
            if (root == null || finished.containsKey(root))
                continue;

            Deque<Map.Entry<Node, Iterator<SymbolicValue>>> stack = new ArrayDeque<>();
            finished.put(root, false);
            stack.push(Map.entry(root, root.getDistinctInputValues().iterator()));
            while (!stack.isEmpty()) {
                Map.Entry<Node, Iterator<SymbolicValue>> top = stack.peek();
                if (!top.getValue().hasNext()) {
                    stack.pop();
                    finished.put(top.getKey(), true);
                    order.add(top.getKey());
                    continue;
                }
                Node producer = resolveProducer(top.getValue().next(), declaredInputs, reachedInputs);
                if (producer == null)
                    continue;
                Boolean state = finished.get(producer);
                if (Boolean.FALSE.equals(state))
                    throw new CycleDetectedException(producer.getLayer().getName());
                if (state == null) {
                    finished.put(producer, false);
                    stack.push(Map.entry(producer, producer.getDistinctInputValues().iterator()));
                }
            }
        }

        for (SymbolicValue input : inputs) {
            if (!reachedInputs.contains(input))
                LOG.warn("Graph '{}': input '{}' is not used by any output", getName(), input.getName());
        }
        return order;
    }

    private Node resolveProducer(SymbolicValue value, Set<SymbolicValue> declaredInputs, Set<SymbolicValue> reachedInputs) {
        if (value.getProducer() != null)
            return value.getProducer();
        if (!declaredInputs.contains(value))
            throw new GraphConstructionException("Graph '" + getName() + "' is disconnected: value '" + value.getName()
                + "' is required by the outputs but is not one of the declared inputs " + getInputNames());
        reachedInputs.add(value);
        return null;
    }

    private List<Layer> collectLayers() {
        Set<Layer> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Layer> result = new ArrayList<>();
        for (Node node : nodes) {
            if (seen.add(node.getLayer()))
                result.add(node.getLayer());
        }
        return result;
    }

    private Map<String, Layer> indexLayers() {
        Map<String, Layer> byName = new LinkedHashMap<>();
        for (Layer layer : layers) {
            if (byName.put(layer.getName(), layer) != null)
                throw new GraphConstructionException("Graph '" + getName() + "' contains two different layers named '"
                    + layer.getName() + "'; layer names must be unique");
        }
        Set<String> inputNames = new HashSet<>();
        for (SymbolicValue input : inputs) {
            if (!inputNames.add(input.getName()) || byName.containsKey(input.getName()))
                throw new GraphConstructionException("Graph '" + getName() + "': input name '" + input.getName()
                    + "' is used more than once");
        }
        return Collections.unmodifiableMap(byName);
    }

    // Depth 0 holds nodes whose outputs no other node of this graph consumes.
    private Map<Integer, List<Node>> computeDepths() {
        Set<Node> members = Collections.newSetFromMap(new IdentityHashMap<>());
        members.addAll(nodes);
        Map<Node, List<Node>> consumers = new IdentityHashMap<>();
        for (Node node : nodes) {
            for (Node inbound : node.getInboundNodes()) {
                if (members.contains(inbound))
                    consumers.computeIfAbsent(inbound, n -> new ArrayList<>()).add(node);
            }
        }

        Map<Node, Integer> depths = new IdentityHashMap<>();
        Map<Integer, List<Node>> byDepth = new TreeMap<>();
        for (int i = nodes.size() - 1; i >= 0; i--) {
            Node node = nodes.get(i);
            int depth = 0;
            for (Node consumer : consumers.getOrDefault(node, List.of()))
                depth = Math.max(depth, depths.get(consumer) + 1);
            depths.put(node, depth);
            byDepth.computeIfAbsent(depth, d -> new ArrayList<>()).add(node);
        }
        byDepth.replaceAll((depth, list) -> List.copyOf(list));
        return byDepth;
    }

    // ===============================
    // LAYER CONTRACT
    // ===============================

    @Override
    public List<Shape> computeOutputShape(List<Shape> inputShapes) {
        if (inputShapes.size() != inputs.size())
            throw new IllegalArgumentException("Graph '" + getName() + "' expects " + inputs.size()
                + " inputs but got " + inputShapes.size());
        Map<Integer, Shape> shapes = new HashMap<>();
        for (int i = 0; i < inputs.size(); i++)
            shapes.put(inputs.get(i).getId(), inputShapes.get(i));

        for (Node node : nodes) {
            List<Shape> nodeInputShapes = new ArrayList<>(node.getInputValues().size());
            for (SymbolicValue input : node.getInputValues())
                nodeInputShapes.add(shapes.get(input.getId()));
            List<Shape> nodeOutputShapes = node.getLayer().computeOutputShape(nodeInputShapes);
            List<SymbolicValue> nodeOutputs = node.getOutputValues();
            for (int i = 0; i < nodeOutputs.size(); i++)
                shapes.put(nodeOutputs.get(i).getId(), nodeOutputShapes.get(i));
        }

        List<Shape> result = new ArrayList<>(outputs.size());
        for (SymbolicValue output : outputs)
            result.add(shapes.get(output.getId()));
        return result;
    }

    @Override
    protected DataType computeOutputDtype(List<DataType> inputTypes, int outputIndex) {
        return outputs.get(outputIndex).getDtype();
    }

    @Override
    public List<Tensor> forward(List<Tensor> inputTensors, boolean training, CallArguments args) {
        return executor.execute(outputs, feedFor(inputTensors), isTraining(training, args));
    }

    /**
     * Computes all outputs in inference mode.
     *
     * @param inputTensors one tensor per declared input, in order
     */
    public List<Tensor> predict(List<Tensor> inputTensors) {
        return executor.execute(outputs, feedFor(inputTensors), false);
    }

    /**
     * Single-input, single-output inference.
     */
    public Tensor predict(Tensor input) {
        if (outputs.size() != 1)
            throw new IllegalStateException("Graph '" + getName() + "' has " + outputs.size() + " outputs; use predict(List)");
        return predict(List.of(input)).get(0);
    }

    private FeedDict feedFor(List<Tensor> inputTensors) {
        if (inputTensors.size() != inputs.size())
            throw new IllegalArgumentException("Graph '" + getName() + "' expects " + inputs.size()
                + " input tensors but got " + inputTensors.size());
        FeedDict feed = new FeedDict();
        for (int i = 0; i < inputs.size(); i++)
            feed.add(inputs.get(i), inputTensors.get(i));
        return feed;
    }

    // ===============================
    // WEIGHTS
    // ===============================

    @Override
    public List<WeightDescriptor> getWeightDescriptors() {
        List<WeightDescriptor> descriptors = new ArrayList<>();
        for (Layer layer : layers)
            descriptors.addAll(layer.getWeightDescriptors());
        return descriptors;
    }

    @Override
    public List<Tensor> getWeights() {
        List<Tensor> weights = new ArrayList<>();
        for (Layer layer : layers)
            weights.addAll(layer.getWeights());
        return weights;
    }

    /**
     * Assigns the weights of every layer, in {@link #getWeightDescriptors()} order. Nothing is
     * assigned unless every value fits.
     */
    @Override
    public void setWeights(List<Tensor> weights) {
        List<Parameter> parameters = getParameters();
        if (weights.size() != parameters.size())
            throw new ConfigurationException("Graph '" + getName() + "' expects " + parameters.size()
                + " weight values but got " + weights.size());
        for (int i = 0; i < parameters.size(); i++)
            parameters.get(i).checkAssignable(weights.get(i));
        int offset = 0;
        for (Layer layer : layers) {
            int count = layer.getWeightDescriptors().size();
            layer.setWeights(weights.subList(offset, offset + count));
            offset += count;
        }
    }

    @Override
    public List<Parameter> getParameters() {
        List<Parameter> parameters = new ArrayList<>();
        for (Layer layer : layers)
            parameters.addAll(layer.getParameters());
        return parameters;
    }

    @Override
    public int countParams() {
        int count = 0;
        for (Layer layer : layers)
            count += layer.countParams();
        return count;
    }

    @Override
    public void setTrainable(boolean trainable) {
        super.setTrainable(trainable);
        for (Layer layer : layers)
            layer.setTrainable(trainable);
    }

    // ===============================
    // QUERIES
    // ===============================

    public List<SymbolicValue> getInputs() {
        return inputs;
    }

    public List<SymbolicValue> getOutputs() {
        return outputs;
    }

    public List<String> getInputNames() {
        List<String> names = new ArrayList<>(inputs.size());
        for (SymbolicValue input : inputs)
            names.add(input.getName());
        return names;
    }

    public List<String> getOutputNames() {
        List<String> names = new ArrayList<>(outputs.size());
        for (SymbolicValue output : outputs)
            names.add(output.getName());
        return names;
    }

    /**
     * Layers in the order their first node is evaluated.
     */
    public List<Layer> getLayers() {
        return layers;
    }

    /**
     * @throws IllegalArgumentException if no layer has that name
     */
    public Layer getLayer(String layerName) {
        Layer layer = layersByName.get(layerName);
        if (layer == null)
            throw new IllegalArgumentException("Graph '" + getName() + "' has no layer named '" + layerName + "'");
        return layer;
    }

    public Layer getLayer(int index) {
        if (index < 0 || index >= layers.size())
            throw new IllegalArgumentException("Graph '" + getName() + "' has " + layers.size()
                + " layers; index " + index + " is out of range");
        return layers.get(index);
    }

    /**
     * Nodes of this graph, producers before consumers.
     */
    public List<Node> getNodes() {
        return nodes;
    }

    /**
     * Nodes grouped by distance from the outputs. Depth 0 holds nodes no other node of this graph
     * consumes; a node's depth exceeds that of every node consuming its outputs.
     */
    public Map<Integer, List<Node>> getNodesByDepth() {
        return nodesByDepth;
    }

    /**
     * Whether {@code node} is one of this graph's nodes. A shared layer may have nodes outside it.
     */
    public boolean containsNode(Node node) {
        for (Node member : nodes) {
            if (member == node)
                return true;
        }
        return false;
    }

    public GraphExecutor getExecutor() {
        return executor;
    }

    /**
     * Tabular description: one row per layer with its output shapes, parameter count and the
     * layers feeding it.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        String separator = "-".repeat(96) + "\n";
        sb.append("Graph: ").append(getName()).append("\n");
        sb.append(separator);
        sb.append(String.format("%-32s %-24s %10s   %s%n", "Layer (type)", "Output shape", "Params", "Connected to"));
        sb.append(separator);
        for (SymbolicValue input : inputs)
            sb.append(String.format("%-32s %-24s %10d   %s%n", input.getName() + " (Input)", input.getShape(), 0, ""));
        for (Layer layer : layers) {
            List<String> outputShapes = new ArrayList<>();
            List<String> inbound = new ArrayList<>();
            for (Node node : nodes) {
                if (node.getLayer() != layer)
                    continue;
                for (SymbolicValue output : node.getOutputValues())
                    outputShapes.add(output.getShape().toString());
                for (SymbolicValue input : node.getInputValues())
                    inbound.add(input.getName());
            }
            String shapes = outputShapes.size() == 1 ? outputShapes.get(0) : outputShapes.toString();
            sb.append(String.format("%-32s %-24s %10d   %s%n", layer.getName() + " (" + layer.getClassName() + ")",
                shapes, layer.countParams(), String.join(", ", inbound)));
        }
        sb.append(separator);
        int trainable = 0;
        for (Parameter parameter : getParameters()) {
            if (parameter.isTrainable())
                trainable += parameter.size();
        }
        sb.append("Total params: ").append(countParams()).append("\n");
        sb.append("Trainable params: ").append(trainable).append("\n");
        return sb.toString();
    }

    // ===============================
    // CONFIGURATION
    // ===============================

    @Override
    public String getClassName() {
        return CLASS_NAME;
    }

    @Override
    public Map<String, Object> getConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("name", getName());
        config.put("graph", toConfig());
        return config;
    }

    /**
     * Structure of this graph, enough to rebuild it with {@link #fromConfig}. Weights are not
     * included.
     */
    public GraphConfig toConfig() {
        return GraphConfig.of(this);
    }

    /**
     * Rebuilds a graph from its configuration. The new graph has freshly initialized weights.
     *
     * @throws ConfigurationException if the configuration names an unknown layer class or
     *                                cannot be replayed
     */
    public static Graph fromConfig(GraphConfig config, LayerRegistry registry) {
        return config.rebuild(registry);
    }

    @Override
    public String toString() {
        return "Graph{" + getName() + ", inputs=" + getInputNames() + ", outputs=" + getOutputNames()
            + ", layers=" + layers.size() + "}";
    }
}
