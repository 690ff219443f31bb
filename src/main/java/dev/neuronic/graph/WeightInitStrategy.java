package dev.neuronic.graph;

import dev.neuronic.graph.math.FastRandom;

import java.util.Arrays;
import java.util.Locale;

/**
 * Weight initialization strategies for layer parameters.
 *
 * <p>The choice of initialization strategy significantly affects training performance
 * and convergence. Different strategies work better with different activation functions.
 * Fan-in and fan-out are taken from the last two dimensions of the weight shape (a vector
 * weight such as a bias has fan-in equal to its length).
 */
public enum WeightInitStrategy {

    /**
     * All zeros. The usual choice for biases.
     */
    ZEROS,

    /**
     * All ones. Handy for deterministic tests and for scale parameters.
     */
    ONES,

    /**
     * Xavier/Glorot uniform initialization: U(-limit, +limit) with
     * limit = sqrt(6 / (fanIn + fanOut)).
     *
     * <p><strong>When to use:</strong>
     * <ul>
     *   <li>With sigmoid activation functions (recommended default)</li>
     *   <li>With tanh activation functions (recommended default)</li>
     *   <li>When training is unstable with He initialization</li>
     * </ul>
     */
    XAVIER,

    /**
     * He initialization: w = random_gaussian * sqrt(2 / fanIn)
     *
     * <p><strong>When to use:</strong>
     * <ul>
     *   <li>With ReLU and Leaky ReLU activation functions</li>
     *   <li>With any activation that zeros negative inputs</li>
     * </ul>
     */
    HE;

    /**
     * Fresh values for a weight of the given fully defined shape.
     */
    public float[] initialize(Shape shape, FastRandom random) {
        float[] values = new float[shape.toFlatSize()];
        switch (this) {
            case ZEROS -> Arrays.fill(values, 0f);
            case ONES -> Arrays.fill(values, 1f);
            case XAVIER -> {
                float limit = (float) Math.sqrt(6.0 / (fanIn(shape) + fanOut(shape)));
                random.fillUniform(values, -limit, limit);
            }
            case HE -> random.fillGaussian(values, 0f, (float) Math.sqrt(2.0 / fanIn(shape)));
        }
        return values;
    }

    private static int fanIn(Shape shape) {
        if (shape.rank() == 0)
            return 1;
        return shape.rank() == 1 ? shape.dim(0) : shape.dim(shape.rank() - 2);
    }

    private static int fanOut(Shape shape) {
        return shape.rank() == 0 ? 1 : shape.last();
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WeightInitStrategy fromConfigName(String name) {
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
