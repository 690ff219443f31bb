package dev.neuronic.graph.exec;

import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.topology.SymbolicValue;

/**
 * A concrete value for a symbolic value.
 */
public record Feed(SymbolicValue key, Tensor value) {

    public Feed {
        if (key == null || value == null)
            throw new IllegalArgumentException("Feed key and value must not be null");
    }
}
