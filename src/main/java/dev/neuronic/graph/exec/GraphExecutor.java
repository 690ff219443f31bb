package dev.neuronic.graph.exec;

import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.errors.FeedException;
import dev.neuronic.graph.errors.LayerGraphException;
import dev.neuronic.graph.errors.LayerInvocationException;
import dev.neuronic.graph.topology.Node;
import dev.neuronic.graph.topology.SymbolicValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Computes concrete values for symbolic values from a feed.
 *
 * <p><b>What it does:</b>
 * <ol>
 *   <li>Walks backwards from the fetches to build an {@link ExecutionPlan}. The walk stops at
 *       fed values, so the producer of a fed intermediate value never runs.</li>
 *   <li>Evaluates every planned node exactly once, producers first, on a private copy of the
 *       feed. Outputs already present (because they were fed) are not overwritten.</li>
 *   <li>In inference mode, drops an intermediate value as soon as its last consumer has run.
 *       Fetched values and externally fed values are never dropped. Nothing is dropped in
 *       training mode.</li>
 *   <li>Returns the fetched values in the caller's order, duplicates included.</li>
 * </ol>
 *
 * <p><b>Parallel evaluation:</b> when constructed with an {@link ExecutorService}, the nodes of
 * each independent wave (see {@link ExecutionPlan#waves()}) run concurrently. Storing outputs
 * and releasing values still happens on the calling thread between waves, so the results are
 * identical to sequential evaluation.
 *
 * <p>An executor holds no per-call state and may be reused; concurrent calls on graphs sharing
 * layers are only safe while those layers' weights are not being updated.
 */
public class GraphExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(GraphExecutor.class);

    private final ExecutorService executorService;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public GraphExecutor() {
        this(null);
    }

    /**
     * @param executorService pool for evaluating independent nodes, or null to evaluate
     *                        everything on the calling thread
     */
    public GraphExecutor(ExecutorService executorService) {
        this.executorService = executorService;
    }

    public GraphExecutor addListener(ExecutionListener listener) {
        listeners.add(listener);
        return this;
    }

    public void removeListener(ExecutionListener listener) {
        listeners.remove(listener);
    }

    public boolean isParallel() {
        return executorService != null;
    }

    public Tensor execute(SymbolicValue fetch, FeedDict feed) {
        return execute(List.of(fetch), feed, false).get(0);
    }

    public List<Tensor> execute(List<SymbolicValue> fetches, FeedDict feed) {
        return execute(fetches, feed, false);
    }

    /**
     * @param fetches  values to compute; may contain duplicates
     * @param feed     concrete values for graph inputs and, optionally, intermediate values;
     *                 not modified
     * @param training whether layers run in training mode; also disables release
     * @return one tensor per fetch, in order
     * @throws dev.neuronic.graph.errors.MissingFeedException   if a needed graph input is not fed
     * @throws dev.neuronic.graph.errors.CycleDetectedException if the dependency walk finds a cycle
     * @throws LayerInvocationException                          if a layer's forward fails
     */
    public List<Tensor> execute(List<SymbolicValue> fetches, FeedDict feed, boolean training) {
        ExecutionPlan plan = ExecutionPlan.create(fetches, feed);
        LOG.debug("Executing {} nodes for {} fetches (training={}, parallel={})",
            plan.size(), fetches.size(), training, isParallel());

        Run run = new Run(plan, feed, training);
        if (executorService == null) {
            for (Node node : plan.getNodes())
                run.complete(node, invoke(node, run.gatherInputs(node), training));
        } else {
            for (List<Node> wave : plan.waves())
                runWave(run, wave, training);
        }

        List<Tensor> results = new ArrayList<>(fetches.size());
        for (SymbolicValue fetch : fetches)
            results.add(run.working.getValue(fetch));
        return results;
    }

    private void runWave(Run run, List<Node> wave, boolean training) {
        if (wave.size() == 1) {
            Node node = wave.get(0);
            run.complete(node, invoke(node, run.gatherInputs(node), training));
            return;
        }

        List<Future<List<Tensor>>> futures = new ArrayList<>(wave.size());
        for (Node node : wave) {
            List<Tensor> inputs = run.gatherInputs(node);
            futures.add(executorService.submit(() -> invoke(node, inputs, training)));
        }

        for (int i = 0; i < wave.size(); i++) {
            List<Tensor> outputs;
            try {
                outputs = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new LayerGraphException("Interrupted while evaluating node " + wave.get(i), e);
            } catch (ExecutionException e) {
                cancelAll(futures);
                Throwable cause = e.getCause();
                if (cause instanceof LayerInvocationException)
                    throw (LayerInvocationException) cause;
                throw new LayerInvocationException(wave.get(i).getLayer().getName(), wave.get(i).getNodeIndex(), cause);
            }
            run.complete(wave.get(i), outputs);
        }
    }

    private static void cancelAll(List<Future<List<Tensor>>> futures) {
        for (Future<List<Tensor>> future : futures)
            future.cancel(true);
    }

    private static List<Tensor> invoke(Node node, List<Tensor> inputs, boolean training) {
        List<Tensor> outputs;
        try {
            outputs = node.getLayer().call(inputs, training, node.getCallArguments());
        } catch (RuntimeException e) {
            throw new LayerInvocationException(node.getLayer().getName(), node.getNodeIndex(), e);
        }

        int expected = node.getOutputValues().size();
        if (outputs == null || outputs.size() != expected)
            throw new LayerInvocationException(node.getLayer().getName(), node.getNodeIndex(),
                "expected " + expected + " output tensors but got " + (outputs == null ? "null" : outputs.size()));
        for (int i = 0; i < expected; i++) {
            if (outputs.get(i) == null)
                throw new LayerInvocationException(node.getLayer().getName(), node.getNodeIndex(),
                    "output tensor " + i + " is null");
        }
        return outputs;
    }

    /**
     * Per-call state: the working feed and the remaining recipient counts.
     */
    private final class Run {
        final ExecutionPlan plan;
        final FeedDict external;
        final FeedDict working;
        final boolean training;
        final Map<Integer, Integer> remaining;

        Run(ExecutionPlan plan, FeedDict external, boolean training) {
            this.plan = plan;
            this.external = external;
            this.working = new FeedDict(external);
            this.training = training;
            this.remaining = new HashMap<>(plan.recipientCounts());
        }

        List<Tensor> gatherInputs(Node node) {
            List<Tensor> inputs = new ArrayList<>(node.getInputValues().size());
            for (SymbolicValue input : node.getInputValues())
                inputs.add(working.getValue(input));
            return inputs;
        }

        void complete(Node node, List<Tensor> outputs) {
            List<SymbolicValue> outputValues = node.getOutputValues();
            for (int i = 0; i < outputValues.size(); i++) {
                SymbolicValue output = outputValues.get(i);
                if (working.hasKey(output))
                    continue;
                try {
                    working.add(output, outputs.get(i));
                } catch (FeedException e) {
                    throw new LayerInvocationException(node.getLayer().getName(), node.getNodeIndex(), e);
                }
            }
            for (ExecutionListener listener : listeners)
                listener.onNodeEvaluated(node, outputs);

            if (training)
                return;
            for (SymbolicValue input : node.getDistinctInputValues()) {
                int left = remaining.merge(input.getId(), -1, Integer::sum);
                if (left == 0)
                    releaseIfTransient(input);
            }
            // outputs nobody in this plan reads, e.g. unused outputs of a multi-output layer
            for (SymbolicValue output : outputValues) {
                if (!remaining.containsKey(output.getId()))
                    releaseIfTransient(output);
            }
        }

        private void releaseIfTransient(SymbolicValue value) {
            if (plan.isFetch(value) || external.hasKey(value) || !working.hasKey(value))
                return;
            working.release(value);
            LOG.trace("Released {}", value.getName());
            for (ExecutionListener listener : listeners)
                listener.onValueReleased(value);
        }
    }
}
