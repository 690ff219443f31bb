package dev.neuronic.graph.topology;

import dev.neuronic.graph.DataType;
import dev.neuronic.graph.Shape;
import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.errors.ConfigurationException;

/**
 * A named weight of a layer. Shape and type are fixed when the layer is built; only the value
 * may be replaced, e.g. by a weight loader or an optimizer.
 */
public final class Parameter {

    private final String layerName;
    private final String name;
    private final Shape shape;
    private final DataType dtype;
    private final boolean trainable;
    private volatile Tensor value;

    Parameter(String layerName, String name, Tensor initialValue, boolean trainable) {
        this.layerName = layerName;
        this.name = name;
        this.shape = initialValue.shape();
        this.dtype = initialValue.dtype();
        this.trainable = trainable;
        this.value = initialValue;
    }

    public String getName() {
        return name;
    }

    public String getQualifiedName() {
        return layerName + "/" + name;
    }

    public Shape getShape() {
        return shape;
    }

    public DataType getDtype() {
        return dtype;
    }

    public boolean isTrainable() {
        return trainable;
    }

    public Tensor getValue() {
        return value;
    }

    /**
     * Replace the value. The new tensor must have exactly this parameter's shape; numeric types
     * are cast to this parameter's type.
     */
    public void assign(Tensor newValue) {
        checkAssignable(newValue);
        this.value = newValue.cast(dtype);
    }

    /**
     * @throws ConfigurationException if {@code newValue} cannot be assigned to this parameter
     */
    public void checkAssignable(Tensor newValue) {
        if (newValue == null)
            throw new ConfigurationException("Weight " + getQualifiedName() + " cannot be assigned null");
        if (!shape.equals(newValue.shape()))
            throw new ConfigurationException("Weight " + getQualifiedName() + " has shape " + shape
                + " but the assigned value has shape " + newValue.shape());
        if (!newValue.dtype().canCastTo(dtype))
            throw new ConfigurationException("Weight " + getQualifiedName() + " has dtype " + dtype
                + " but the assigned value has dtype " + newValue.dtype());
    }

    public int size() {
        return shape.toFlatSize();
    }

    public WeightDescriptor describe() {
        return new WeightDescriptor(getQualifiedName(), shape, dtype);
    }
}
