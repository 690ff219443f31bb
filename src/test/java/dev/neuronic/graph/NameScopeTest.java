package dev.neuronic.graph;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NameScopeTest {

    @Test
    void testCountersPerBase() {
        NameScope scope = new NameScope();

        assertEquals("dense_1", scope.uniqueName("dense"));
        assertEquals("dense_2", scope.uniqueName("dense"));
        assertEquals("add_1", scope.uniqueName("add"));
    }

    @Test
    void testPrefix() {
        NameScope scope = new NameScope("encoder/");

        assertEquals("encoder/dense_1", scope.uniqueName("dense"));
        assertEquals("encoder/", scope.prefix());
    }

    @Test
    void testReserve() {
        NameScope scope = new NameScope();
        scope.reserve("dense_7");
        scope.reserve("dense_3");
        scope.reserve("custom");
        scope.reserve("dense_x");

        assertEquals("dense_8", scope.uniqueName("dense"));
        assertEquals("custom_1", scope.uniqueName("custom"));
    }

    @Test
    void testReserveIgnoresOtherPrefixes() {
        NameScope scope = new NameScope("a/");
        scope.reserve("b/dense_5");

        assertEquals("a/dense_1", scope.uniqueName("dense"));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new NameScope(null));
        assertThrows(IllegalArgumentException.class, () -> new NameScope().uniqueName(""));
    }
}
