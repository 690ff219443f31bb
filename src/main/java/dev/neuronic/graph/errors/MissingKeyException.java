package dev.neuronic.graph.errors;

public class MissingKeyException extends FeedException {

    public MissingKeyException(String valueName) {
        super(valueName, "Nonexistent key: " + valueName);
    }
}
