package dev.neuronic.graph.activators;

/**
 * Leaky Rectified Linear Unit (Leaky ReLU) activation function.
 *
 * <p>LeakyReLU(x) = x if x > 0, else alpha * x
 *
 * <p>A variant of ReLU that keeps a small slope for inactive units.
 */
public final class LeakyReluActivator implements Activator {

    public static final float DEFAULT_ALPHA = 0.01f;

    private final float alpha;

    /**
     * @param alpha the slope for negative inputs (typically 0.01 to 0.3)
     */
    public LeakyReluActivator(float alpha) {
        if (alpha <= 0 || alpha >= 1)
            throw new IllegalArgumentException("Alpha must be between 0 and 1, got: " + alpha);
        this.alpha = alpha;
    }

    public static LeakyReluActivator createDefault() {
        return new LeakyReluActivator(DEFAULT_ALPHA);
    }

    public static LeakyReluActivator create(float alpha) {
        return new LeakyReluActivator(alpha);
    }

    public float getAlpha() {
        return alpha;
    }

    @Override
    public void activate(float[] input, float[] output) {
        Activator.checkLength(input, output);
        for (int i = 0; i < input.length; i++)
            output[i] = input[i] > 0 ? input[i] : alpha * input[i];
    }

    @Override
    public String getName() {
        return "leakyRelu";
    }
}
