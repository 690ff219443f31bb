package dev.neuronic.graph.layers;

import dev.neuronic.graph.activators.Activator;
import dev.neuronic.graph.activators.Activators;
import dev.neuronic.graph.activators.LeakyReluActivator;
import dev.neuronic.graph.config.ConfigValues;
import dev.neuronic.graph.errors.ConfigurationException;

import java.util.Map;

/**
 * Reads and writes the {@code activation} entry (plus {@code alpha} for leaky ReLU) of a layer
 * configuration.
 */
final class ActivationConfig {

    static final String ACTIVATION = "activation";
    static final String ALPHA = "alpha";

    private ActivationConfig() {}

    static void write(Activator activator, Map<String, Object> config) {
        config.put(ACTIVATION, activator.getName());
        if (activator instanceof LeakyReluActivator)
            config.put(ALPHA, ((LeakyReluActivator) activator).getAlpha());
    }

    static Activator read(Map<String, Object> config) {
        String name = ConfigValues.string(config, ACTIVATION, "linear");
        try {
            if ("leakyRelu".equals(name) && config.containsKey(ALPHA))
                return LeakyReluActivator.create(ConfigValues.decimal(config, ALPHA));
            return Activators.byName(name);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }
}
