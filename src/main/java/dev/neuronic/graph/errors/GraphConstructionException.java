package dev.neuronic.graph.errors;

/**
 * A graph could not be assembled from its declared inputs and outputs.
 */
public class GraphConstructionException extends LayerGraphException {

    public GraphConstructionException(String message) {
        super(message);
    }
}
