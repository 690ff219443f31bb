package dev.neuronic.graph.config;

import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Graph;
import dev.neuronic.graph.topology.Inputs;
import dev.neuronic.graph.topology.Layer;
import dev.neuronic.graph.topology.Node;
import dev.neuronic.graph.topology.SymbolicValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain-data description of a {@link Graph}: its inputs, every layer with its configuration and
 * calls, and its outputs. Holds no references to the live objects, so an equivalent graph can be
 * rebuilt from it with a {@link LayerRegistry}.
 *
 * <p>Node indices in {@link NodeRef}s count only the calls that belong to this graph. A layer
 * shared with other graphs may have more calls than its config lists.
 */
public record GraphConfig(String name, List<InputSpec> inputs, List<LayerConfig> layers, List<NodeRef> outputs) {

    private static final Logger LOG = LoggerFactory.getLogger(GraphConfig.class);

    public GraphConfig {
        inputs = List.copyOf(inputs);
        layers = List.copyOf(layers);
        outputs = List.copyOf(outputs);
    }

    // ===============================
    // SNAPSHOT
    // ===============================

    public static GraphConfig of(Graph graph) {
        Map<Node, Integer> localIndex = new IdentityHashMap<>();
        for (Layer layer : graph.getLayers()) {
            int next = 0;
            for (Node node : layer.getInboundNodes()) {
                if (graph.containsNode(node))
                    localIndex.put(node, next++);
            }
        }

        List<InputSpec> inputSpecs = new ArrayList<>();
        for (SymbolicValue input : graph.getInputs())
            inputSpecs.add(new InputSpec(input.getName(), input.getShape(), input.getDtype()));

        List<LayerConfig> layerConfigs = new ArrayList<>();
        for (Layer layer : graph.getLayers()) {
            List<NodeConfig> nodeConfigs = new ArrayList<>();
            for (Node node : layer.getInboundNodes()) {
                if (!localIndex.containsKey(node))
                    continue;
                List<NodeRef> refs = new ArrayList<>();
                for (SymbolicValue value : node.getInputValues())
                    refs.add(ref(value, localIndex));
                nodeConfigs.add(new NodeConfig(refs, node.getCallArguments().asMap()));
            }
            layerConfigs.add(new LayerConfig(layer.getClassName(), layer.getName(), layer.getConfig(), nodeConfigs));
        }

        List<NodeRef> outputRefs = new ArrayList<>();
        for (SymbolicValue output : graph.getOutputs())
            outputRefs.add(ref(output, localIndex));
        return new GraphConfig(graph.getName(), inputSpecs, layerConfigs, outputRefs);
    }

    private static NodeRef ref(SymbolicValue value, Map<Node, Integer> localIndex) {
        if (value.isGraphInput())
            return NodeRef.input(value.getName());
        Node producer = value.getProducer();
        return new NodeRef(producer.getLayer().getName(), localIndex.get(producer), value.getProducerOutputIndex());
    }

    // ===============================
    // REBUILD
    // ===============================

    /**
     * Creates fresh layers through the registry and replays every recorded call. Calls whose
     * inputs are not available yet (a shared layer called again further down the graph) are
     * deferred until they are.
     *
     * @throws ConfigurationException if a layer class is unknown, a reference cannot be resolved
     *                                or the calls cannot all be replayed
     */
    public Graph rebuild(LayerRegistry registry) {
        Map<String, SymbolicValue> inputValues = new LinkedHashMap<>();
        for (InputSpec spec : inputs)
            inputValues.put(spec.name(), Inputs.input(spec.shape(), spec.dtype(), spec.name()));

        Map<String, Layer> created = new LinkedHashMap<>();
        Map<String, Deque<NodeConfig>> pending = new LinkedHashMap<>();
        Map<String, List<List<SymbolicValue>>> produced = new LinkedHashMap<>();
        for (LayerConfig layerConfig : layers) {
            if (created.containsKey(layerConfig.name()) || inputValues.containsKey(layerConfig.name()))
                throw new ConfigurationException("Graph config '" + name + "' uses the name '" + layerConfig.name() + "' twice");
            created.put(layerConfig.name(), registry.create(layerConfig));
            pending.put(layerConfig.name(), new ArrayDeque<>(layerConfig.inboundNodes()));
            produced.put(layerConfig.name(), new ArrayList<>());
        }

        int remaining = countPending(pending);
        while (remaining > 0) {
            for (Map.Entry<String, Deque<NodeConfig>> entry : pending.entrySet()) {
                Deque<NodeConfig> queue = entry.getValue();
                while (!queue.isEmpty()) {
                    List<SymbolicValue> nodeInputs = resolveAll(queue.peek().inputs(), inputValues, produced);
                    if (nodeInputs == null)
                        break;
                    NodeConfig nodeConfig = queue.poll();
                    Layer layer = created.get(entry.getKey());
                    produced.get(entry.getKey()).add(layer.apply(nodeInputs, CallArguments.of(nodeConfig.callArguments())));
                }
            }
            int stillPending = countPending(pending);
            if (stillPending == remaining)
                throw new ConfigurationException("Graph config '" + name + "' cannot be replayed: " + stillPending
                    + " layer calls depend on values that are never produced");
            remaining = stillPending;
        }

        List<SymbolicValue> outputValues = new ArrayList<>();
        for (NodeRef ref : outputs) {
            SymbolicValue value = resolve(ref, inputValues, produced);
            if (value == null)
                throw new ConfigurationException("Graph config '" + name + "' declares output " + ref + " that is never produced");
            outputValues.add(value);
        }
        LOG.debug("Rebuilt graph '{}' with {} layers", name, created.size());
        return new Graph(name, new ArrayList<>(inputValues.values()), outputValues);
    }

    private static int countPending(Map<String, Deque<NodeConfig>> pending) {
        int count = 0;
        for (Deque<NodeConfig> queue : pending.values())
            count += queue.size();
        return count;
    }

    /**
     * All referenced values, or null if any of them is not produced yet.
     */
    private static List<SymbolicValue> resolveAll(List<NodeRef> refs, Map<String, SymbolicValue> inputValues,
                                                  Map<String, List<List<SymbolicValue>>> produced) {
        List<SymbolicValue> values = new ArrayList<>(refs.size());
        for (NodeRef ref : refs) {
            SymbolicValue value = resolve(ref, inputValues, produced);
            if (value == null)
                return null;
            values.add(value);
        }
        return values;
    }

    private static SymbolicValue resolve(NodeRef ref, Map<String, SymbolicValue> inputValues,
                                         Map<String, List<List<SymbolicValue>>> produced) {
        SymbolicValue input = inputValues.get(ref.layerName());
        if (input != null)
            return input;
        List<List<SymbolicValue>> calls = produced.get(ref.layerName());
        if (calls == null)
            throw new ConfigurationException("Reference to unknown layer or input '" + ref.layerName() + "'");
        if (ref.nodeIndex() >= calls.size())
            return null;
        List<SymbolicValue> outputs = calls.get(ref.nodeIndex());
        if (ref.valueIndex() >= outputs.size())
            throw new ConfigurationException("Layer '" + ref.layerName() + "' has no output " + ref.valueIndex());
        return outputs.get(ref.valueIndex());
    }
}
