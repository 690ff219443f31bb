package dev.neuronic.graph.activators;

/**
 * Logistic sigmoid: f(x) = 1 / (1 + exp(-x)).
 */
public final class SigmoidActivator implements Activator {

    public static final SigmoidActivator INSTANCE = new SigmoidActivator();

    private SigmoidActivator() {}

    @Override
    public void activate(float[] input, float[] output) {
        Activator.checkLength(input, output);
        for (int i = 0; i < input.length; i++)
            output[i] = (float) (1.0 / (1.0 + Math.exp(-input[i])));
    }

    @Override
    public String getName() {
        return "sigmoid";
    }
}
