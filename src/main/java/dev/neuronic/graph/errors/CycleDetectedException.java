package dev.neuronic.graph.errors;

/**
 * A backward walk reached a node that is still on its own active path.
 */
public class CycleDetectedException extends GraphConstructionException {

    private final String layerName;

    public CycleDetectedException(String layerName) {
        super("Cycle detected at a node of layer '" + layerName + "'");
        this.layerName = layerName;
    }

    public String getLayerName() {
        return layerName;
    }
}
