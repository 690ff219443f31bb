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

public class MergeTest {

    private static final float EPSILON = 1e-6f;

    private static final Tensor A = Tensor.matrix(new float[][]{{1f, 5f, -2f}});
    private static final Tensor B = Tensor.matrix(new float[][]{{3f, 2f, -4f}});
    private static final Tensor C = Tensor.matrix(new float[][]{{2f, 2f, 0f}});

    private static float[] run(Merge layer, Tensor... inputs) {
        return layer.forward(List.of(inputs), false, CallArguments.empty()).get(0).toFloatArray();
    }

    @Test
    void testElementWiseOperations() {
        assertArrayEquals(new float[]{6f, 9f, -6f}, run(new Add("add"), A, B, C), EPSILON);
        assertArrayEquals(new float[]{6f, 20f, 0f}, run(new Multiply("multiply"), A, B, C), EPSILON);
        assertArrayEquals(new float[]{2f, 3f, -2f}, run(new Average("average"), A, B, C), EPSILON);
        assertArrayEquals(new float[]{3f, 5f, 0f}, run(new Maximum("maximum"), A, B, C), EPSILON);
        assertArrayEquals(new float[]{1f, 2f, -4f}, run(new Minimum("minimum"), A, B, C), EPSILON);
    }

    @Test
    void testSymbolicShapes() {
        SymbolicValue x = Inputs.input(Shape.batched(3), "x");
        SymbolicValue y = Inputs.input(Shape.batched(3), "y");

        assertEquals(Shape.batched(3), new Add("add").apply(x, y).getShape());
    }

    @Test
    void testBroadcasting() {
        assertEquals(Shape.of(2, 3), Merge.broadcast(Shape.of(2, 3), Shape.of(1, 3)));
        assertEquals(Shape.of(2, 3), Merge.broadcast(Shape.of(2, 3), Shape.vector(3)));
        assertEquals(Shape.batched(3), Merge.broadcast(Shape.batched(3), Shape.of(1, 3)));
        assertEquals(Shape.batched(3), Merge.broadcast(Shape.batched(1), Shape.batched(3)));

        Tensor matrix = Tensor.matrix(new float[][]{{1f, 2f, 3f}, {4f, 5f, 6f}});
        Tensor row = Tensor.vector(10f, 20f, 30f);
        assertArrayEquals(new float[]{11f, 22f, 33f, 14f, 25f, 36f}, run(new Add("add"), matrix, row), EPSILON);

        Tensor column = Tensor.matrix(new float[][]{{2f}, {3f}});
        assertArrayEquals(new float[]{2f, 4f, 6f, 12f, 15f, 18f}, run(new Multiply("multiply"), matrix, column), EPSILON);
    }

    @Test
    void testIncompatibleShapesRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Merge.broadcast(Shape.of(2, 3), Shape.of(2, 4)));
        assertTrue(e.getMessage().startsWith("Operands could not be broadcast together"));

        SymbolicValue x = Inputs.input(Shape.batched(3), "x");
        SymbolicValue y = Inputs.input(Shape.batched(4), "y");
        assertThrows(ConfigurationException.class, () -> new Add("add").apply(x, y));
    }

    @Test
    void testSingleInputRejected() {
        SymbolicValue x = Inputs.input(Shape.batched(3), "x");

        assertThrows(ConfigurationException.class, () -> new Add("add").apply(x));
        assertThrows(IllegalArgumentException.class, () -> run(new Add("add"), A));
    }

    @Test
    void testFromConfig() {
        Average average = Average.fromConfig(new Average("avg").getConfig());
        assertEquals("avg", average.getName());
        assertEquals("Average", average.getClassName());
    }
}
