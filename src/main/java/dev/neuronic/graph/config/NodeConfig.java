package dev.neuronic.graph.config;

import java.util.List;
import java.util.Map;

/**
 * One recorded call of a layer: the values it consumed and its non-tensor call arguments.
 */
public record NodeConfig(List<NodeRef> inputs, Map<String, Object> callArguments) {

    public NodeConfig {
        inputs = List.copyOf(inputs);
        callArguments = callArguments == null ? Map.of() : Map.copyOf(callArguments);
    }
}
