package dev.neuronic.graph.activators;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ActivatorsTest {

    private static final float EPSILON = 1e-3f;

    @Test
    void testLookupByName() {
        for (String name : Activators.NAMES)
            assertEquals(name, Activators.byName(name).getName());
        assertSame(LinearActivator.INSTANCE, Activators.byName(null));
        assertThrows(IllegalArgumentException.class, () -> Activators.byName("swish"));
    }

    @Test
    void testElementWiseActivators() {
        float[] input = {-2f, 0f, 3f};
        float[] output = new float[3];

        ReluActivator.INSTANCE.activate(input, output);
        assertArrayEquals(new float[]{0f, 0f, 3f}, output, EPSILON);

        LeakyReluActivator.create(0.1f).activate(input, output);
        assertArrayEquals(new float[]{-0.2f, 0f, 3f}, output, EPSILON);

        TanhActivator.INSTANCE.activate(input, output);
        assertArrayEquals(new float[]{-0.964f, 0f, 0.995f}, output, EPSILON);

        LinearActivator.INSTANCE.activate(input, output);
        assertArrayEquals(input, output, 0f);
    }

    @Test
    void testInPlaceActivation() {
        float[] values = {-1f, 2f};
        ReluActivator.INSTANCE.activate(values, values);
        assertArrayEquals(new float[]{0f, 2f}, values, 0f);
    }

    @Test
    void testSoftmax() {
        float[] output = new float[3];
        SoftmaxActivator.INSTANCE.activate(new float[]{2f, 1f, 3f}, output);
        assertArrayEquals(new float[]{0.245f, 0.090f, 0.665f}, output, EPSILON);
    }

    @Test
    void testSoftmaxRows() {
        float[] output = new float[4];
        SoftmaxActivator.INSTANCE.activateRows(new float[]{0f, 0f, 5f, 5f}, output, 2);
        assertArrayEquals(new float[]{0.5f, 0.5f, 0.5f, 0.5f}, output, EPSILON);

        assertThrows(IllegalArgumentException.class,
            () -> SoftmaxActivator.INSTANCE.activateRows(new float[3], new float[3], 2));
    }

    @Test
    void testLengthMismatchRejected() {
        assertThrows(IllegalArgumentException.class, () -> ReluActivator.INSTANCE.activate(new float[2], new float[3]));
    }

    @Test
    void testLeakyReluAlphaRange() {
        assertEquals(LeakyReluActivator.DEFAULT_ALPHA, LeakyReluActivator.createDefault().getAlpha(), 0f);
        assertThrows(IllegalArgumentException.class, () -> LeakyReluActivator.create(0f));
        assertThrows(IllegalArgumentException.class, () -> LeakyReluActivator.create(1f));
    }
}
