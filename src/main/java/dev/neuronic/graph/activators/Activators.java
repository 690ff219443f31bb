package dev.neuronic.graph.activators;

import java.util.List;

/**
 * Lookup of activators by configuration name.
 */
public final class Activators {

    private Activators() {}

    public static final List<String> NAMES = List.of("linear", "relu", "leakyRelu", "sigmoid", "tanh", "softmax");

    /**
     * @param name one of {@link #NAMES}; {@code null} means linear
     * @throws IllegalArgumentException for unknown names
     */
    public static Activator byName(String name) {
        if (name == null)
            return LinearActivator.INSTANCE;
        switch (name) {
            case "linear":
                return LinearActivator.INSTANCE;
            case "relu":
                return ReluActivator.INSTANCE;
            case "leakyRelu":
                return LeakyReluActivator.createDefault();
            case "sigmoid":
                return SigmoidActivator.INSTANCE;
            case "tanh":
                return TanhActivator.INSTANCE;
            case "softmax":
                return SoftmaxActivator.INSTANCE;
            default:
                throw new IllegalArgumentException("Unknown activation '" + name + "', expected one of " + NAMES);
        }
    }
}
