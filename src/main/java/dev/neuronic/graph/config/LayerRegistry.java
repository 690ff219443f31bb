package dev.neuronic.graph.config;

import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.layers.Activation;
import dev.neuronic.graph.layers.Add;
import dev.neuronic.graph.layers.Average;
import dev.neuronic.graph.layers.Concatenate;
import dev.neuronic.graph.layers.Dense;
import dev.neuronic.graph.layers.Dropout;
import dev.neuronic.graph.layers.Flatten;
import dev.neuronic.graph.layers.Identity;
import dev.neuronic.graph.layers.Maximum;
import dev.neuronic.graph.layers.Minimum;
import dev.neuronic.graph.layers.Multiply;
import dev.neuronic.graph.layers.RepeatVector;
import dev.neuronic.graph.layers.Reshape;
import dev.neuronic.graph.topology.Graph;
import dev.neuronic.graph.topology.Layer;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps layer class names to factories that recreate a layer from its configuration.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LayerRegistry registry = LayerRegistry.withBuiltins()
 *     .register("Scale", (config, r) -> Scale.fromConfig(config));
 * Graph copy = Graph.fromConfig(graph.toConfig(), registry);
 * }</pre>
 *
 * <p>Every layer shipped with the library is registered by {@link #withBuiltins()}, including
 * {@code Graph} for nested graphs. Registries are independent instances; thread-safe.
 */
public final class LayerRegistry {

    /**
     * Creates a layer from its configuration map. The registry is passed along for layers that
     * contain other layers.
     */
    @FunctionalInterface
    public interface LayerFactory {
        Layer create(Map<String, Object> config, LayerRegistry registry);
    }

    private final Map<String, LayerFactory> factories = new ConcurrentHashMap<>();

    /**
     * An empty registry.
     */
    public LayerRegistry() {
    }

    public static LayerRegistry withBuiltins() {
        LayerRegistry registry = new LayerRegistry();
        registry.register("Dense", (config, r) -> Dense.fromConfig(config));
        registry.register("Activation", (config, r) -> Activation.fromConfig(config));
        registry.register("Dropout", (config, r) -> Dropout.fromConfig(config));
        registry.register("Flatten", (config, r) -> Flatten.fromConfig(config));
        registry.register("Reshape", (config, r) -> Reshape.fromConfig(config));
        registry.register("RepeatVector", (config, r) -> RepeatVector.fromConfig(config));
        registry.register("Identity", (config, r) -> Identity.fromConfig(config));
        registry.register("Add", (config, r) -> Add.fromConfig(config));
        registry.register("Multiply", (config, r) -> Multiply.fromConfig(config));
        registry.register("Average", (config, r) -> Average.fromConfig(config));
        registry.register("Maximum", (config, r) -> Maximum.fromConfig(config));
        registry.register("Minimum", (config, r) -> Minimum.fromConfig(config));
        registry.register("Concatenate", (config, r) -> Concatenate.fromConfig(config));
        registry.register(Graph.CLASS_NAME, LayerRegistry::createGraph);
        return registry;
    }

    private static Layer createGraph(Map<String, Object> config, LayerRegistry registry) {
        Object nested = config.get("graph");
        if (!(nested instanceof GraphConfig))
            throw new ConfigurationException("Graph layer config needs a 'graph' entry holding a GraphConfig");
        return ((GraphConfig) nested).rebuild(registry);
    }

    /**
     * @throws ConfigurationException if the class name is already registered
     */
    public LayerRegistry register(String className, LayerFactory factory) {
        if (factories.putIfAbsent(className, factory) != null)
            throw new ConfigurationException("Layer class '" + className + "' is already registered");
        return this;
    }

    public boolean supports(String className) {
        return factories.containsKey(className);
    }

    public Set<String> getRegisteredClassNames() {
        return new TreeSet<>(factories.keySet());
    }

    /**
     * Creates the layer described by {@code config} and applies its {@code trainable} flag, if set.
     *
     * @throws ConfigurationException for unknown class names or invalid configurations
     */
    public Layer create(LayerConfig config) {
        LayerFactory factory = factories.get(config.className());
        if (factory == null)
            throw new ConfigurationException("Unknown layer class '" + config.className() + "' for layer '"
                + config.name() + "'. Available classes: " + getRegisteredClassNames());

        Layer layer;
        try {
            layer = factory.create(config.config(), this);
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ConfigurationException("Invalid config for layer '" + config.name() + "': " + e.getMessage(), e);
        }
        if (!layer.getName().equals(config.name()))
            throw new ConfigurationException("Factory for '" + config.className() + "' created layer '"
                + layer.getName() + "' but the config names it '" + config.name() + "'");
        if (config.config().containsKey("trainable"))
            layer.setTrainable(ConfigValues.bool(config.config(), "trainable", true));
        return layer;
    }
}
