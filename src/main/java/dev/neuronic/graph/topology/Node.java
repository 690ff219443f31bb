package dev.neuronic.graph.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One recorded invocation of a {@link Layer}: the symbolic values it consumed, the values it
 * produced and the non-tensor arguments of the call.
 *
 * <p>For every output {@code i}, {@code getOutputValues().get(i).getProducer() == this} and
 * {@code getProducerOutputIndex() == i}. Nodes are created by {@link Layer#apply} only and are
 * immutable afterwards. The node refers to its layer but does not own it: the same layer is
 * shared by every node that invokes it.
 */
public final class Node {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    private final Layer layer;
    private final int nodeIndex;
    private final List<SymbolicValue> inputValues;
    private final CallArguments callArguments;
    private List<SymbolicValue> outputValues = List.of();

    Node(Layer layer, int nodeIndex, List<SymbolicValue> inputValues, CallArguments callArguments) {
        this.id = NEXT_ID.getAndIncrement();
        this.layer = layer;
        this.nodeIndex = nodeIndex;
        this.inputValues = List.copyOf(inputValues);
        this.callArguments = callArguments;
    }

    void attachOutputs(List<SymbolicValue> outputs) {
        if (!outputValues.isEmpty())
            throw new IllegalStateException("Outputs of node " + this + " are already attached");
        for (int i = 0; i < outputs.size(); i++) {
            SymbolicValue output = outputs.get(i);
            if (output.getProducer() != this || output.getProducerOutputIndex() != i)
                throw new IllegalStateException("Output " + i + " of node " + this + " has a different producer");
        }
        this.outputValues = List.copyOf(outputs);
    }

    /**
     * Process-unique node id.
     */
    public int getId() {
        return id;
    }

    public Layer getLayer() {
        return layer;
    }

    /**
     * Position of this node among all invocations of its layer.
     */
    public int getNodeIndex() {
        return nodeIndex;
    }

    public List<SymbolicValue> getInputValues() {
        return inputValues;
    }

    public List<SymbolicValue> getOutputValues() {
        return outputValues;
    }

    public CallArguments getCallArguments() {
        return callArguments;
    }

    /**
     * Input values without repetition, in first-use order. A node reading the same value twice
     * (e.g. {@code add(x, x)}) still consumes it once.
     */
    public List<SymbolicValue> getDistinctInputValues() {
        Set<SymbolicValue> distinct = new LinkedHashSet<>(inputValues);
        return distinct.size() == inputValues.size() ? inputValues : List.copyOf(distinct);
    }

    /**
     * Nodes that produced this node's inputs, without repetition. Graph inputs contribute nothing.
     */
    public List<Node> getInboundNodes() {
        Set<Node> inbound = new LinkedHashSet<>();
        for (SymbolicValue input : inputValues) {
            if (input.getProducer() != null)
                inbound.add(input.getProducer());
        }
        return Collections.unmodifiableList(new ArrayList<>(inbound));
    }

    @Override
    public String toString() {
        return layer.getName() + "#" + nodeIndex;
    }
}
