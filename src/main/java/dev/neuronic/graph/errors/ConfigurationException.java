package dev.neuronic.graph.errors;

/**
 * Invalid layer construction arguments, an invocation whose shapes are incompatible with the
 * shapes a layer was built for, or weights that do not match a layer's parameters.
 */
public class ConfigurationException extends LayerGraphException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
