package dev.neuronic.graph.errors;

/**
 * Root of all errors raised by the layer graph runtime.
 */
public class LayerGraphException extends RuntimeException {

    public LayerGraphException(String message) {
        super(message);
    }

    public LayerGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
