package dev.neuronic.graph.topology;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;

/**
 * Name, shape and type of one layer weight, in the order a weight loader must supply values.
 *
 * @param name  fully qualified name, {@code layerName/weightName}
 */
public record WeightDescriptor(String name, Shape shape, DataType dtype) {
}
