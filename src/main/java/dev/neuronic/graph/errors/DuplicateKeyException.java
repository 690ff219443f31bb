package dev.neuronic.graph.errors;

public class DuplicateKeyException extends FeedException {

    public DuplicateKeyException(String valueName, int id) {
        super(valueName, "Duplicate key: name=" + valueName + ", id=" + id);
    }
}
