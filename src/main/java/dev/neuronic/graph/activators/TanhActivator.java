package dev.neuronic.graph.activators;

public final class TanhActivator implements Activator {

    public static final TanhActivator INSTANCE = new TanhActivator();

    private TanhActivator() {}

    @Override
    public void activate(float[] input, float[] output) {
        Activator.checkLength(input, output);
        for (int i = 0; i < input.length; i++)
            output[i] = (float) Math.tanh(input[i]);
    }

    @Override
    public String getName() {
        return "tanh";
    }
}
