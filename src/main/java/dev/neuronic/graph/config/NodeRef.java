package dev.neuronic.graph.config;

/**
 * Reference to one value of a graph configuration: output {@code valueIndex} of the
 * {@code nodeIndex}-th call of layer {@code layerName} within the graph. A graph input is
 * referenced by its own name with indices 0.
 */
public record NodeRef(String layerName, int nodeIndex, int valueIndex) {

    public NodeRef {
        if (layerName == null || layerName.isEmpty())
            throw new IllegalArgumentException("NodeRef needs a layer name");
        if (nodeIndex < 0 || valueIndex < 0)
            throw new IllegalArgumentException("NodeRef indices must be non-negative: " + nodeIndex + ", " + valueIndex);
    }

    public static NodeRef input(String inputName) {
        return new NodeRef(inputName, 0, 0);
    }
}
