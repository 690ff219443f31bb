package dev.neuronic.graph.activators;

/**
 * Softmax over each row: softmax(x_i) = exp(x_i - max(x)) / sum(exp(x_j - max(x))).
 *
 * <p>Every row of the output is a probability distribution summing to 1. Subtracting the row
 * maximum before exponentiating keeps large logits from overflowing.
 *
 * <p><strong>Example:</strong>
 * <pre>
 * Input:  [2.0, 1.0, 3.0]
 * Output: [0.245, 0.090, 0.665]
 * </pre>
 */
public final class SoftmaxActivator implements Activator {

    public static final SoftmaxActivator INSTANCE = new SoftmaxActivator();

    private SoftmaxActivator() {}

    /**
     * Treats the whole buffer as a single row.
     */
    @Override
    public void activate(float[] input, float[] output) {
        activateRows(input, output, input.length);
    }

    @Override
    public void activateRows(float[] input, float[] output, int rowLength) {
        Activator.checkLength(input, output);
        if (rowLength <= 0 || input.length % rowLength != 0)
            throw new IllegalArgumentException("Row length " + rowLength + " does not divide buffer length " + input.length);
        for (int start = 0; start < input.length; start += rowLength)
            softmaxRow(input, output, start, start + rowLength);
    }

    private static void softmaxRow(float[] input, float[] output, int from, int to) {
        float maxVal = input[from];
        for (int i = from + 1; i < to; i++) {
            if (input[i] > maxVal)
                maxVal = input[i];
        }

        float sum = 0.0f;
        for (int i = from; i < to; i++) {
            output[i] = (float) Math.exp(input[i] - maxVal);
            sum += output[i];
        }

        for (int i = from; i < to; i++)
            output[i] /= sum;
    }

    @Override
    public String getName() {
        return "softmax";
    }
}
