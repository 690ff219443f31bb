package dev.neuronic.graph.exec;

import dev.neuronic.graph.CountingLayer;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.topology.Inputs;
import dev.neuronic.graph.topology.Node;
import dev.neuronic.graph.topology.SymbolicValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionPlanTest {

    private static final Shape SHAPE = Shape.batched(2);

    @Test
    void testPlanContainsOnlyNeededNodes() {
        SymbolicValue x = Inputs.input(SHAPE, "x");
        CountingLayer a = new CountingLayer("a");
        CountingLayer b = new CountingLayer("b");
        CountingLayer unrelated = new CountingLayer("unrelated");
        SymbolicValue va = a.apply(x);
        SymbolicValue vb = b.apply(va);
        unrelated.apply(va);

        ExecutionPlan plan = ExecutionPlan.create(List.of(vb), new FeedDict().add(x, Tensor.zeros(Shape.of(1, 2))));

        assertEquals(List.of(va.getProducer(), vb.getProducer()), plan.getNodes());
        assertEquals(1, plan.getRecipientCount(va.getId()), "the unrelated consumer is not part of the plan");
        assertEquals(1, plan.getRecipientCount(x.getId()));
        assertEquals(0, plan.getRecipientCount(vb.getId()));
        assertTrue(plan.isFetch(vb));
        assertFalse(plan.isFetch(va));
    }

    @Test
    void testRecipientsCountedPerConsumingNode() {
        SymbolicValue x = Inputs.input(SHAPE, "x");
        CountingLayer a = new CountingLayer("a");
        CountingLayer twice = new CountingLayer("twice");
        CountingLayer other = new CountingLayer("other");
        SymbolicValue va = a.apply(x);
        SymbolicValue left = twice.apply(va, va);
        SymbolicValue right = other.apply(va);

        ExecutionPlan plan = ExecutionPlan.create(List.of(left, right), new FeedDict().add(x, Tensor.zeros(Shape.of(1, 2))));

        assertEquals(2, plan.getRecipientCount(va.getId()));
        assertEquals(3, plan.size());
    }

    @Test
    void testFedValueIsALeaf() {
        SymbolicValue x = Inputs.input(SHAPE, "x");
        SymbolicValue va = new CountingLayer("a").apply(x);
        SymbolicValue vb = new CountingLayer("b").apply(va);

        ExecutionPlan plan = ExecutionPlan.create(List.of(vb), new FeedDict().add(va, Tensor.zeros(Shape.of(1, 2))));

        assertEquals(List.of(vb.getProducer()), plan.getNodes());
        assertEquals(0, plan.getRecipientCount(x.getId()));
    }

    @Test
    void testWavesGroupIndependentNodes() {
        SymbolicValue x = Inputs.input(SHAPE, "x");
        SymbolicValue a = new CountingLayer("a").apply(x);
        SymbolicValue b = new CountingLayer("b").apply(x);
        SymbolicValue c = new CountingLayer("c").apply(a);
        SymbolicValue d = new CountingLayer("d").apply(c, b);

        ExecutionPlan plan = ExecutionPlan.create(List.of(d), new FeedDict().add(x, Tensor.zeros(Shape.of(1, 2))));
        List<List<Node>> waves = plan.waves();

        assertEquals(3, waves.size());
        assertEquals(2, waves.get(0).size());
        assertTrue(waves.get(0).contains(a.getProducer()));
        assertTrue(waves.get(0).contains(b.getProducer()));
        assertEquals(List.of(c.getProducer()), waves.get(1));
        assertEquals(List.of(d.getProducer()), waves.get(2));
    }
}
