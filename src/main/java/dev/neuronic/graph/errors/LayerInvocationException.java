package dev.neuronic.graph.errors;

/**
 * A layer's forward computation failed while a graph was being executed. The original failure
 * is kept as the cause.
 */
public class LayerInvocationException extends LayerGraphException {

    private final String layerName;
    private final int nodeIndex;

    public LayerInvocationException(String layerName, int nodeIndex, Throwable cause) {
        super("Layer '" + layerName + "' failed at node " + nodeIndex + ": " + cause.getMessage(), cause);
        this.layerName = layerName;
        this.nodeIndex = nodeIndex;
    }

    public LayerInvocationException(String layerName, int nodeIndex, String message) {
        super("Layer '" + layerName + "' failed at node " + nodeIndex + ": " + message);
        this.layerName = layerName;
        this.nodeIndex = nodeIndex;
    }

    public String getLayerName() {
        return layerName;
    }

    public int getNodeIndex() {
        return nodeIndex;
    }
}
