package dev.neuronic.graph.activators;

/**
 * Rectified Linear Unit: ReLU(x) = max(0, x).
 */
public final class ReluActivator implements Activator {

    public static final ReluActivator INSTANCE = new ReluActivator();

    private ReluActivator() {}

    @Override
    public void activate(float[] input, float[] output) {
        Activator.checkLength(input, output);
        for (int i = 0; i < input.length; i++)
            output[i] = Math.max(0f, input[i]);
    }

    @Override
    public String getName() {
        return "relu";
    }
}
