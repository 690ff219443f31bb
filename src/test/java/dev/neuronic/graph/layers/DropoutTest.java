package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Inputs;
import dev.neuronic.graph.topology.SymbolicValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DropoutTest {

    private static final float EPSILON = 1e-6f;

    private static Tensor run(Dropout dropout, Tensor input, boolean training, CallArguments args) {
        return dropout.forward(List.of(input), training, args).get(0);
    }

    @Test
    void testInferencePassesInputThrough() {
        Dropout dropout = new Dropout("dropout", 0.5f);
        Tensor input = Tensor.ones(Shape.of(2, 50));

        assertSame(input, run(dropout, input, false, CallArguments.empty()));
    }

    @Test
    void testTrainingDropsAndRescales() {
        Dropout dropout = new Dropout("dropout", 0.5f, 3L);
        Tensor input = Tensor.ones(Shape.of(4, 100));

        float[] out = run(dropout, input, true, CallArguments.empty()).toFloatArray();

        int dropped = 0;
        for (float value : out) {
            if (value == 0f)
                dropped++;
            else
                assertEquals(2f, value, EPSILON);
        }
        assertTrue(dropped > 100 && dropped < 300, "about half dropped, got " + dropped);
    }

    @Test
    void testSeededCallsAreReproducible() {
        Dropout a = new Dropout("a", 0.3f, 11L);
        Dropout b = new Dropout("b", 0.3f, 11L);
        Tensor input = Tensor.ones(Shape.of(1, 200));

        Tensor firstA = run(a, input, true, CallArguments.empty());
        Tensor firstB = run(b, input, true, CallArguments.empty());
        Tensor secondA = run(a, input, true, CallArguments.empty());

        assertEquals(firstA, firstB);
        assertNotEquals(firstA, secondA, "each call draws a new mask");
    }

    @Test
    void testCallArgumentOverridesMode() {
        Dropout dropout = new Dropout("dropout", 0.5f, 5L);
        Tensor input = Tensor.ones(Shape.of(1, 100));

        assertSame(input, run(dropout, input, true, CallArguments.training(false)));
        assertNotEquals(input, run(dropout, input, false, CallArguments.training(true)));
    }

    @Test
    void testZeroRateIsIdentity() {
        Dropout dropout = new Dropout("dropout", 0f);
        Tensor input = Tensor.ones(Shape.of(1, 10));

        assertSame(input, run(dropout, input, true, CallArguments.empty()));
    }

    @Test
    void testShapeIsPreserved() {
        SymbolicValue y = new Dropout("dropout", 0.1f).apply(Inputs.input(Shape.batched(4, 3), "x"));
        assertEquals(Shape.batched(4, 3), y.getShape());
    }

    @Test
    void testInvalidRate() {
        assertThrows(ConfigurationException.class, () -> new Dropout("dropout", 1f));
        assertThrows(ConfigurationException.class, () -> new Dropout("dropout", -0.1f));
    }

    @Test
    void testConfigRoundTrip() {
        Dropout copy = Dropout.fromConfig(new Dropout("dropout", 0.25f, 8L).getConfig());

        assertEquals("dropout", copy.getName());
        assertEquals(0.25f, copy.getRate(), EPSILON);
        assertEquals(8L, copy.getConfig().get("seed"));
    }
}
