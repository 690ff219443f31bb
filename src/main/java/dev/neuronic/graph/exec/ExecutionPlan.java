package dev.neuronic.graph.exec;

import dev.neuronic.graph.errors.CycleDetectedException;
import dev.neuronic.graph.errors.MissingFeedException;
import dev.neuronic.graph.topology.Node;
import dev.neuronic.graph.topology.SymbolicValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The nodes one execution must evaluate, in an order where every node follows the producers of
 * its inputs, together with how many of those nodes consume each value.
 *
 * <p>The backward walk starts at the fetches and stops at any value present in the feed, so a
 * fed intermediate value is a leaf and its producer is not part of the plan (unless another of
 * the producer's outputs is needed). Each node appears once no matter how many fetches or
 * consumers depend on it.
 */
public final class ExecutionPlan {

    private enum State { ACTIVE, DONE }

    private final List<Node> nodes;
    private final Map<Integer, Integer> recipientCounts;
    private final Set<Integer> fetchIds;

    private ExecutionPlan(List<Node> nodes, Map<Integer, Integer> recipientCounts, Set<Integer> fetchIds) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.recipientCounts = Collections.unmodifiableMap(recipientCounts);
        this.fetchIds = Collections.unmodifiableSet(fetchIds);
    }

    /**
     * @throws MissingFeedException   if a needed graph input is not in the feed
     * @throws CycleDetectedException if the walk reaches a node on its own active path
     */
    public static ExecutionPlan create(List<SymbolicValue> fetches, FeedDict feed) {
        List<Node> order = new ArrayList<>();
        Map<Integer, State> states = new HashMap<>();
        Map<Integer, Integer> recipientCounts = new HashMap<>();
        Set<Integer> fetchIds = new HashSet<>();

        for (SymbolicValue fetch : fetches) {
            fetchIds.add(fetch.getId());
            Node producer = requireProducer(fetch, feed);
            if (producer != null && !states.containsKey(producer.getId()))
                walk(producer, feed, states, recipientCounts, order);
        }
        return new ExecutionPlan(order, recipientCounts, fetchIds);
    }

    /**
     * Producer to descend into, or null when the value is a leaf because it is fed.
     */
    private static Node requireProducer(SymbolicValue value, FeedDict feed) {
        if (feed.hasKey(value))
            return null;
        if (value.getProducer() == null)
            throw new MissingFeedException(value.getName());
        return value.getProducer();
    }

    // Iterative post-order so deep graphs cannot overflow the call stack.
    private static void walk(Node root, FeedDict feed, Map<Integer, State> states,
                             Map<Integer, Integer> recipientCounts, List<Node> order) {
        Deque<Frame> stack = new ArrayDeque<>();
        states.put(root.getId(), State.ACTIVE);
        stack.push(new Frame(root));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.inputs.hasNext()) {
                stack.pop();
                states.put(frame.node.getId(), State.DONE);
                order.add(frame.node);
                continue;
            }

            SymbolicValue input = frame.inputs.next();
            recipientCounts.merge(input.getId(), 1, Integer::sum);
            Node producer = requireProducer(input, feed);
            if (producer == null)
                continue;
            State state = states.get(producer.getId());
            if (state == State.ACTIVE)
                throw new CycleDetectedException(producer.getLayer().getName());
            if (state == null) {
                states.put(producer.getId(), State.ACTIVE);
                stack.push(new Frame(producer));
            }
        }
    }

    private static final class Frame {
        final Node node;
        final Iterator<SymbolicValue> inputs;

        Frame(Node node) {
            this.node = node;
            this.inputs = node.getDistinctInputValues().iterator();
        }
    }

    /**
     * Nodes to evaluate, producers before consumers.
     */
    public List<Node> getNodes() {
        return nodes;
    }

    /**
     * Number of planned nodes consuming the value with the given id.
     */
    public int getRecipientCount(int valueId) {
        return recipientCounts.getOrDefault(valueId, 0);
    }

    Map<Integer, Integer> recipientCounts() {
        return recipientCounts;
    }

    public boolean isFetch(SymbolicValue value) {
        return fetchIds.contains(value.getId());
    }

    /**
     * Groups the planned nodes into waves: every node's in-plan producers are in earlier waves,
     * so the nodes of one wave are independent of each other.
     */
    public List<List<Node>> waves() {
        Map<Integer, Integer> levels = new HashMap<>();
        List<List<Node>> waves = new ArrayList<>();
        for (Node node : nodes) {
            int level = 0;
            for (Node inbound : node.getInboundNodes()) {
                Integer inboundLevel = levels.get(inbound.getId());
                if (inboundLevel != null)
                    level = Math.max(level, inboundLevel + 1);
            }
            levels.put(node.getId(), level);
            while (waves.size() <= level)
                waves.add(new ArrayList<>());
            waves.get(level).add(node);
        }
        return waves;
    }

    public int size() {
        return nodes.size();
    }
}
