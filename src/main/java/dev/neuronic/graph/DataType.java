package dev.neuronic.graph;

/**
 * Element type of a tensor.
 *
 * <p>Numeric and boolean types share a {@code float[]} storage and may be cast into each
 * other. String tensors cannot be cast to or from any other type.
 */
public enum DataType {

    FLOAT32("float32"),
    INT32("int32"),
    BOOL("bool"),
    STRING("string");

    private final String configName;

    DataType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public boolean isNumeric() {
        return this != STRING;
    }

    public boolean canCastTo(DataType target) {
        return this == target || (isNumeric() && target.isNumeric());
    }

    public static DataType fromConfigName(String name) {
        for (DataType type : values()) {
            if (type.configName.equals(name))
                return type;
        }
        throw new IllegalArgumentException("Unknown dtype: " + name);
    }

    @Override
    public String toString() {
        return configName;
    }
}
