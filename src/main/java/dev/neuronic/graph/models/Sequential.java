package dev.neuronic.graph.models;

import dev.neuronic.graph.NameScope;

/**
 * Entry point for linear stacks of layers.
 *
 * <pre>{@code
 * Layers layers = new Layers(scope);
 * Graph model = Sequential.newBuilder(scope)
 *     .input(Shape.batched(784))
 *     .add(layers.denseRelu(256))
 *     .add(layers.dropout(0.2f))
 *     .add(layers.denseSoftmax(10))
 *     .build();
 * }</pre>
 */
public final class Sequential {

    private Sequential() {}

    public static SequentialBuilder newBuilder(NameScope scope) {
        return new SequentialBuilder(scope);
    }

    /**
     * Builder with a fresh naming scope.
     */
    public static SequentialBuilder newBuilder() {
        return new SequentialBuilder(new NameScope());
    }
}
