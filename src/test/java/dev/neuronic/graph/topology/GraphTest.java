package dev.neuronic.graph.topology;

import dev.neuronic.graph.CountingLayer;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.WeightInitStrategy;
import dev.neuronic.graph.activators.LinearActivator;
import dev.neuronic.graph.activators.ReluActivator;
import dev.neuronic.graph.errors.ConfigurationException;
import dev.neuronic.graph.errors.GraphConstructionException;
import dev.neuronic.graph.layers.Add;
import dev.neuronic.graph.layers.Dense;
import dev.neuronic.graph.layers.Identity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class GraphTest {

    private static final float EPSILON = 1e-5f;

    private static Dense onesDense(String name, int units) {
        return new Dense(name, units, LinearActivator.INSTANCE, true, WeightInitStrategy.ONES, WeightInitStrategy.ZEROS, null);
    }

    @Test
    void testLayersInEvaluationOrder() {
        SymbolicValue x = Inputs.input(Shape.batched(3), "x");
        Dense first = onesDense("first", 4);
        Dense second = onesDense("second", 2);
        SymbolicValue y = second.apply(first.apply(x));

        Graph graph = new Graph("model", List.of(x), List.of(y));

        assertEquals(List.of(first, second), graph.getLayers());
        assertSame(first, graph.getLayer("first"));
        assertSame(second, graph.getLayer(1));
        assertEquals(List.of("x"), graph.getInputNames());
        assertEquals(List.of("second"), graph.getOutputNames());
        assertEquals(2, graph.getNodes().size());
        assertTrue(graph.isBuilt());
        assertThrows(IllegalArgumentException.class, () -> graph.getLayer("missing"));
        assertThrows(IllegalArgumentException.class, () -> graph.getLayer(2));
    }

    @Test
    void testDisconnectedGraphNamesTheMissingInput() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue y = Inputs.input(Shape.batched(2), "y");
        SymbolicValue sum = new Add("add").apply(x, y);

        GraphConstructionException e = assertThrows(GraphConstructionException.class,
            () -> new Graph("model", List.of(x), List.of(sum)));
        assertTrue(e.getMessage().contains("disconnected"), e.getMessage());
        assertTrue(e.getMessage().contains("'y'"), e.getMessage());
    }

    @Test
    void testUnusedInputAllowed() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue unused = Inputs.input(Shape.batched(2), "unused");
        SymbolicValue y = new Identity("identity").apply(x);

        Graph graph = new Graph("model", List.of(x, unused), List.of(y));

        assertEquals(2, graph.getInputs().size());
        List<Tensor> out = graph.predict(List.of(Tensor.ones(Shape.of(1, 2)), Tensor.zeros(Shape.of(1, 2))));
        assertArrayEquals(new float[]{1f, 1f}, out.get(0).toFloatArray(), EPSILON);
    }

    @Test
    void testInputWithProducerRejected() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue h = new Identity("h").apply(x);
        SymbolicValue y = new Identity("y").apply(h);

        GraphConstructionException e = assertThrows(GraphConstructionException.class,
            () -> new Graph("model", List.of(h), List.of(y)));
        assertTrue(e.getMessage().contains("produced by layer 'h'"), e.getMessage());
    }

    @Test
    void testDuplicateInputRejected() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue y = new Identity("identity").apply(x);

        assertThrows(GraphConstructionException.class, () -> new Graph("model", List.of(x, x), List.of(y)));
    }

    @Test
    void testDuplicateLayerNamesRejected() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue y = new Identity("same").apply(new Identity("same").apply(x));

        GraphConstructionException e = assertThrows(GraphConstructionException.class,
            () -> new Graph("model", List.of(x), List.of(y)));
        assertTrue(e.getMessage().contains("'same'"), e.getMessage());
    }

    @Test
    void testInputNameClashingWithLayerRejected() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "clash");
        SymbolicValue y = new Identity("clash").apply(x);

        assertThrows(GraphConstructionException.class, () -> new Graph("model", List.of(x), List.of(y)));
    }

    @Test
    void testEmptyInputsOrOutputsRejected() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue y = new Identity("identity").apply(x);

        assertThrows(GraphConstructionException.class, () -> new Graph("model", List.of(), List.of(y)));
        assertThrows(GraphConstructionException.class, () -> new Graph("model", List.of(x), List.of()));
    }

    @Test
    void testNodesByDepth() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue a = new CountingLayer("a").apply(x);
        SymbolicValue b = new CountingLayer("b").apply(a);
        SymbolicValue c = new CountingLayer("c").apply(x);

        Graph graph = new Graph("model", List.of(x), List.of(b, c));
        Map<Integer, List<Node>> byDepth = graph.getNodesByDepth();

        assertEquals(2, byDepth.size());
        assertEquals(2, byDepth.get(0).size());
        assertTrue(byDepth.get(0).contains(b.getProducer()));
        assertTrue(byDepth.get(0).contains(c.getProducer()));
        assertEquals(List.of(a.getProducer()), byDepth.get(1));
    }

    @Test
    void testNodesOutsideTheGraphAreExcluded() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        CountingLayer shared = new CountingLayer("shared");
        SymbolicValue inside = shared.apply(x);
        SymbolicValue outside = shared.apply(inside);

        Graph graph = new Graph("model", List.of(x), List.of(inside));

        assertTrue(graph.containsNode(inside.getProducer()));
        assertFalse(graph.containsNode(outside.getProducer()));
        assertEquals(1, graph.getNodes().size());
    }

    @Test
    void testPredictComputesOutputs() {
        SymbolicValue x = Inputs.input(Shape.batched(3), "x");
        SymbolicValue y = onesDense("dense", 2).apply(x);
        Graph graph = new Graph("model", List.of(x), List.of(y));

        Tensor out = graph.predict(Tensor.matrix(new float[][]{{1f, 2f, 3f}, {-1f, 0f, 1f}}));

        assertEquals(Shape.of(2, 2), out.shape());
        assertArrayEquals(new float[]{6f, 6f, 0f, 0f}, out.toFloatArray(), EPSILON);
    }

    @Test
    void testPredictArgumentChecks() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        SymbolicValue split = new CountingLayer("a").apply(x);
        SymbolicValue other = new CountingLayer("b").apply(x);
        Graph graph = new Graph("model", List.of(x), List.of(split, other));

        assertThrows(IllegalStateException.class, () -> graph.predict(Tensor.zeros(Shape.of(1, 2))));
        assertThrows(IllegalArgumentException.class, () -> graph.predict(List.of()));
    }

    @Test
    void testNestedGraphIsOneNode() {
        SymbolicValue innerIn = Inputs.input(Shape.batched(3), "inner_in");
        SymbolicValue innerOut = onesDense("inner_dense", 2).apply(innerIn);
        Graph inner = new Graph("inner", List.of(innerIn), List.of(innerOut));

        SymbolicValue x = Inputs.input(Shape.batched(3), "x");
        SymbolicValue h = inner.apply(x);
        SymbolicValue y = new Dense("head", 1, ReluActivator.INSTANCE, false,
            WeightInitStrategy.ONES, WeightInitStrategy.ZEROS, null).apply(h);
        Graph outer = new Graph("outer", List.of(x), List.of(y));

        assertEquals(Shape.batched(2), h.getShape());
        assertEquals("inner", h.getName());
        assertEquals(List.of(inner, outer.getLayer("head")), outer.getLayers());
        assertEquals(8 + 2, outer.countParams());
        assertEquals(List.of("inner_dense/kernel", "inner_dense/bias", "head/kernel"),
            outer.getWeightDescriptors().stream().map(WeightDescriptor::name).toList());

        Tensor out = outer.predict(Tensor.matrix(new float[][]{{1f, 1f, 1f}}));
        assertEquals(6f, out.get(0, 0), EPSILON);
    }

    @Test
    void testGraphAppliedTwiceSharesWeights() {
        SymbolicValue innerIn = Inputs.input(Shape.batched(2), "inner_in");
        Dense dense = onesDense("dense", 2);
        Graph inner = new Graph("inner", List.of(innerIn), List.of(dense.apply(innerIn)));

        SymbolicValue a = Inputs.input(Shape.batched(2), "a");
        SymbolicValue b = Inputs.input(Shape.batched(2), "b");
        SymbolicValue sum = new Add("sum").apply(inner.apply(a), inner.apply(b));
        Graph outer = new Graph("outer", List.of(a, b), List.of(sum));

        assertEquals(2, inner.getInboundNodes().size());
        assertEquals(6, outer.countParams());

        dense.setWeights(List.of(Tensor.zeros(Shape.of(2, 2)), Tensor.vector(1f, 2f)));
        List<Tensor> out = outer.predict(List.of(Tensor.ones(Shape.of(1, 2)), Tensor.ones(Shape.of(1, 2))));
        assertArrayEquals(new float[]{2f, 4f}, out.get(0).toFloatArray(), EPSILON);
    }

    @Test
    void testGraphRejectsIncompatibleApplication() {
        SymbolicValue innerIn = Inputs.input(Shape.batched(3), "inner_in");
        Graph inner = new Graph("inner", List.of(innerIn), List.of(onesDense("dense", 2).apply(innerIn)));

        assertThrows(ConfigurationException.class, () -> inner.apply(Inputs.input(Shape.batched(4), "x")));
        assertThrows(ConfigurationException.class, () -> inner.apply(List.of(
            Inputs.input(Shape.batched(3), "a"), Inputs.input(Shape.batched(3), "b"))));
    }

    @Test
    void testSetWeightsDistributesToLayers() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        Dense first = onesDense("first", 2);
        Dense second = onesDense("second", 1);
        Graph graph = new Graph("model", List.of(x), List.of(second.apply(first.apply(x))));

        List<Tensor> weights = List.of(
            Tensor.zeros(Shape.of(2, 2)), Tensor.vector(1f, 1f),
            Tensor.ones(Shape.of(2, 1)), Tensor.vector(0.5f));
        graph.setWeights(weights);

        assertEquals(weights, graph.getWeights());
        assertEquals(Tensor.vector(0.5f), second.getWeights().get(1));
        assertThrows(ConfigurationException.class, () -> graph.setWeights(weights.subList(0, 3)));
    }

    @Test
    void testSetTrainablePropagates() {
        SymbolicValue x = Inputs.input(Shape.batched(2), "x");
        Dense dense = onesDense("dense", 2);
        Graph graph = new Graph("model", List.of(x), List.of(dense.apply(x)));

        graph.setTrainable(false);

        assertFalse(graph.isTrainable());
        assertFalse(dense.isTrainable());
    }

    @Test
    void testSummary() {
        SymbolicValue x = Inputs.input(Shape.batched(3), "x");
        Graph graph = new Graph("model", List.of(x), List.of(onesDense("dense", 2).apply(x)));

        String summary = graph.summary();

        assertTrue(summary.contains("Graph: model"));
        assertTrue(summary.contains("dense (Dense)"));
        assertTrue(summary.contains("Total params: 8"));
        assertTrue(summary.contains("Trainable params: 8"));
    }
}
