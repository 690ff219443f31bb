package dev.neuronic.graph.config;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;

public record InputSpec(String name, Shape shape, DataType dtype) {
}
