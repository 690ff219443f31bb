package dev.neuronic.graph.topology;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.NameScope;
import dev.neuronic.graph.Shape;

/**
 * Factory for graph inputs: symbolic values without a producer that must be fed at execution
 * time.
 *
 * <pre>{@code
 * SymbolicValue x = Inputs.input(Shape.batched(784), DataType.FLOAT32, "pixels");
 * }</pre>
 */
public final class Inputs {

    private Inputs() {}

    public static SymbolicValue input(Shape shape, DataType dtype, String name) {
        if (shape == null || dtype == null)
            throw new IllegalArgumentException("Input shape and dtype are required");
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Input name must not be empty");
        return new SymbolicValue(name, shape, dtype, null, -1);
    }

    public static SymbolicValue input(Shape shape, String name) {
        return input(shape, DataType.FLOAT32, name);
    }

    /**
     * Input named from the scope, e.g. {@code input_1}.
     */
    public static SymbolicValue input(Shape shape, DataType dtype, NameScope scope) {
        return input(shape, dtype, scope.uniqueName("input"));
    }
}
