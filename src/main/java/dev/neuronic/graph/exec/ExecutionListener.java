package dev.neuronic.graph.exec;

import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.topology.Node;
import dev.neuronic.graph.topology.SymbolicValue;

import java.util.List;

/**
 * Observes a {@link GraphExecutor} while it runs. Callbacks happen on the thread that called
 * {@code execute}, in evaluation order.
 */
public interface ExecutionListener {

    default void onNodeEvaluated(Node node, List<Tensor> outputs) {
    }

    /**
     * An intermediate value was dropped because no remaining node consumes it.
     */
    default void onValueReleased(SymbolicValue value) {
    }
}
