package dev.neuronic.graph.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A layer of a graph configuration: the registry class name, the layer's constructor arguments
 * and every call of the layer within the graph, in call order.
 */
public record LayerConfig(String className, String name, Map<String, Object> config, List<NodeConfig> inboundNodes) {

    public LayerConfig {
        config = Collections.unmodifiableMap(new LinkedHashMap<>(config));
        inboundNodes = List.copyOf(inboundNodes);
    }
}
