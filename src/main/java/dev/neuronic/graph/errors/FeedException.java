package dev.neuronic.graph.errors;

/**
 * Problem with the concrete value supplied (or not supplied) for a symbolic value.
 * Always names the offending symbolic value.
 */
public class FeedException extends LayerGraphException {

    private final String valueName;

    public FeedException(String valueName, String message) {
        super(message);
        this.valueName = valueName;
    }

    public FeedException(String valueName, String message, Throwable cause) {
        super(message, cause);
        this.valueName = valueName;
    }

    public String getValueName() {
        return valueName;
    }
}
