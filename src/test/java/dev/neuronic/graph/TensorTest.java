package dev.neuronic.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TensorTest {

    private static final float EPSILON = 1e-6f;

    @Test
    void testMatrixAccess() {
        Tensor t = Tensor.matrix(new float[][]{{1f, 2f, 3f}, {4f, 5f, 6f}});

        assertEquals(Shape.of(2, 3), t.shape());
        assertEquals(DataType.FLOAT32, t.dtype());
        assertEquals(6f, t.get(1, 2), EPSILON);
        assertEquals(6, t.size());
        assertThrows(IndexOutOfBoundsException.class, () -> t.get(2, 0));
        assertThrows(IllegalArgumentException.class, () -> t.get(0));
    }

    @Test
    void testValuesAreCopied() {
        float[] data = {1f, 2f};
        Tensor t = Tensor.vector(data);
        data[0] = 10f;
        t.toFloatArray()[1] = 20f;

        assertArrayEquals(new float[]{1f, 2f}, t.toFloatArray(), EPSILON);
    }

    @Test
    void testShapeMustMatchData() {
        assertThrows(IllegalArgumentException.class, () -> Tensor.of(Shape.of(2, 2), 1f, 2f, 3f));
        assertThrows(IllegalArgumentException.class, () -> Tensor.of(Shape.batched(2), 1f, 2f));
        assertThrows(IllegalArgumentException.class, () -> Tensor.matrix(new float[][]{{1f}, {1f, 2f}}));
    }

    @Test
    void testIntegerAndBoolNormalization() {
        assertArrayEquals(new float[]{1f, -2f}, Tensor.of(Shape.vector(2), DataType.INT32, 1.9f, -2.9f).toFloatArray(), EPSILON);
        assertArrayEquals(new float[]{1f, 0f}, Tensor.of(Shape.vector(2), DataType.BOOL, 0.3f, 0f).toFloatArray(), EPSILON);
    }

    @Test
    void testCast() {
        Tensor floats = Tensor.vector(2.5f, 0f);

        assertSame(floats, floats.cast(DataType.FLOAT32));
        assertArrayEquals(new float[]{2f, 0f}, floats.cast(DataType.INT32).toFloatArray(), EPSILON);
        assertArrayEquals(new float[]{1f, 0f}, floats.cast(DataType.BOOL).toFloatArray(), EPSILON);
        assertThrows(IllegalArgumentException.class, () -> floats.cast(DataType.STRING));
        assertThrows(IllegalArgumentException.class, () -> Tensor.strings(Shape.vector(1), "a").cast(DataType.INT32));
    }

    @Test
    void testStrings() {
        Tensor t = Tensor.strings(Shape.of(1, 2), "a", "b");

        assertEquals(DataType.STRING, t.dtype());
        assertEquals("b", t.getString(0, 1));
        assertThrows(IllegalStateException.class, t::toFloatArray);
        assertThrows(IllegalArgumentException.class, () -> Tensor.of(Shape.vector(1), DataType.STRING, 1f));
    }

    @Test
    void testReshape() {
        Tensor t = Tensor.of(Shape.of(2, 3), 1f, 2f, 3f, 4f, 5f, 6f);

        Tensor reshaped = t.reshape(Shape.of(3, 2));
        assertEquals(4f, reshaped.get(1, 1), EPSILON);
        assertThrows(IllegalArgumentException.class, () -> t.reshape(Shape.of(4, 2)));
    }

    @Test
    void testEquality() {
        assertEquals(Tensor.vector(1f, 2f), Tensor.of(Shape.vector(2), 1f, 2f));
        assertNotEquals(Tensor.vector(1f, 2f), Tensor.of(Shape.of(1, 2), 1f, 2f));
        assertNotEquals(Tensor.vector(1f), Tensor.of(Shape.vector(1), DataType.INT32, 1f));
        assertEquals(Tensor.vector(1f, 2f).hashCode(), Tensor.vector(1f, 2f).hashCode());
    }

    @Test
    void testFactories() {
        assertEquals(0, Tensor.scalar(3f).rank());
        assertArrayEquals(new float[]{0f, 0f}, Tensor.zeros(Shape.vector(2)).toFloatArray(), EPSILON);
        assertArrayEquals(new float[]{1f, 1f}, Tensor.ones(Shape.vector(2)).toFloatArray(), EPSILON);
        assertEquals(DataType.INT32, Tensor.fill(Shape.vector(2), DataType.INT32, 7f).dtype());
    }
}
