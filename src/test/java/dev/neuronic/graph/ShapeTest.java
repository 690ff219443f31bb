package dev.neuronic.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ShapeTest {

    @Test
    void testFactories() {
        assertEquals(0, Shape.scalar().rank());
        assertArrayEquals(new int[]{5}, Shape.vector(5).dims());
        assertArrayEquals(new int[]{3, 4}, Shape.sequence(3, 4).dims());
        assertArrayEquals(new int[]{Shape.UNKNOWN, 2, 3}, Shape.batched(2, 3).dims());
    }

    @Test
    void testImmutability() {
        int[] dims = {2, 3};
        Shape shape = Shape.of(dims);
        dims[0] = 99;
        shape.dims()[1] = 99;

        assertEquals(Shape.of(2, 3), shape);
    }

    @Test
    void testInvalidDimensionRejected() {
        assertThrows(IllegalArgumentException.class, () -> Shape.of(2, -5));
    }

    @Test
    void testSizes() {
        assertEquals(24, Shape.of(2, 3, 4).toFlatSize());
        assertEquals(12, Shape.batched(3, 4).flatSizeFrom(1));
        assertEquals(Shape.UNKNOWN, Shape.batched(3, 4).flatSizeFrom(0));
        assertThrows(IllegalStateException.class, () -> Shape.batched(3).toFlatSize());
        assertTrue(Shape.of(1, 2).isFullyDefined());
        assertFalse(Shape.batched(2).isFullyDefined());
    }

    @Test
    void testCompatibility() {
        assertTrue(Shape.batched(3).isCompatibleWith(Shape.of(7, 3)));
        assertFalse(Shape.batched(3).isCompatibleWith(Shape.of(7, 4)));
        assertFalse(Shape.batched(3).isCompatibleWith(Shape.of(3)));
    }

    @Test
    void testDerivedShapes() {
        Shape shape = Shape.of(2, 3);

        assertEquals(Shape.of(2, 5), shape.withDim(1, 5));
        assertEquals(Shape.of(Shape.UNKNOWN, 2, 3), shape.prepend(Shape.UNKNOWN));
        assertEquals(Shape.vector(3), shape.dropFirst());
        assertThrows(IllegalStateException.class, () -> Shape.scalar().dropFirst());
    }

    @Test
    void testToString() {
        assertEquals("Shape[?, 3]", Shape.batched(3).toString());
    }
}
