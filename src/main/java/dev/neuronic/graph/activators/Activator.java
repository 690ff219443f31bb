package dev.neuronic.graph.activators;

/**
 * An activation function applied to a flat buffer of values.
 *
 * <p>Most activators are element-wise and ignore row boundaries. Activators that normalize
 * across a row (softmax) override {@link #activateRows(float[], float[], int)}.
 */
public interface Activator {

    /**
     * Applies the activation to {@code input}, writing into {@code output}. The buffers may be
     * the same array.
     */
    void activate(float[] input, float[] output);

    /**
     * Name used in layer configurations, see {@link Activators#byName(String)}.
     */
    String getName();

    /**
     * Applies the activation row by row, where a row is {@code rowLength} consecutive values
     * (the last axis of a tensor).
     */
    default void activateRows(float[] input, float[] output, int rowLength) {
        activate(input, output);
    }

    static void checkLength(float[] input, float[] output) {
        if (input.length != output.length)
            throw new IllegalArgumentException(
                "Input and output arrays must have same length: " +
                "input=" + input.length + ", output=" + output.length
            );
    }
}
