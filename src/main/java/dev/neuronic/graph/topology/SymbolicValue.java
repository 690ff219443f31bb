package dev.neuronic.graph.topology;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Typed, shaped placeholder for a tensor flowing through a layer graph.
 *
 * <p>Every value except a graph input has exactly one producer {@link Node}; any number of
 * nodes may consume it. Values are immutable and compared by identity; {@link #getId()} is
 * unique for the life of the process and never reused.
 */
public final class SymbolicValue {

    private static final AtomicInteger NEXT_ID = new AtomicInteger();

    private final int id;
    private final String name;
    private final Shape shape;
    private final DataType dtype;
    private final Node producer;
    private final int producerOutputIndex;

    SymbolicValue(String name, Shape shape, DataType dtype, Node producer, int producerOutputIndex) {
        this.id = NEXT_ID.getAndIncrement();
        this.name = name;
        this.shape = shape;
        this.dtype = dtype;
        this.producer = producer;
        this.producerOutputIndex = producerOutputIndex;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Shape getShape() {
        return shape;
    }

    public DataType getDtype() {
        return dtype;
    }

    /**
     * @return the node that produced this value, or {@code null} for a graph input
     */
    public Node getProducer() {
        return producer;
    }

    /**
     * @return output slot of the producer, or -1 for a graph input
     */
    public int getProducerOutputIndex() {
        return producerOutputIndex;
    }

    public boolean isGraphInput() {
        return producer == null;
    }

    @Override
    public String toString() {
        return "SymbolicValue{" + name + ", id=" + id + ", " + shape + ", " + dtype + "}";
    }
}
