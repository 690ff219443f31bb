package dev.neuronic.graph.layers;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.topology.CallArguments;
import dev.neuronic.graph.topology.Inputs;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RepeatVectorTest {

    @Test
    void testRepeatsEachRow() {
        RepeatVector repeat = new RepeatVector("repeat", 3);

        assertEquals(Shape.batched(3, 2), repeat.apply(Inputs.input(Shape.batched(2), "x")).getShape());

        Tensor out = repeat.forward(List.of(Tensor.matrix(new float[][]{{1f, 2f}, {3f, 4f}})),
            false, CallArguments.empty()).get(0);
        assertEquals(Shape.of(2, 3, 2), out.shape());
        assertArrayEquals(new float[]{1f, 2f, 1f, 2f, 1f, 2f, 3f, 4f, 3f, 4f, 3f, 4f}, out.toFloatArray(), 0f);
    }

    @Test
    void testInvalidArguments() {
        assertThrows(ConfigurationException.class, () -> new RepeatVector("repeat", 0));
        assertThrows(ConfigurationException.class,
            () -> new RepeatVector("repeat", 2).apply(Inputs.input(Shape.batched(2, 2), "x")));
    }

    @Test
    void testConfigRoundTrip() {
        assertEquals(4, RepeatVector.fromConfig(new RepeatVector("repeat", 4).getConfig()).getN());
    }
}
