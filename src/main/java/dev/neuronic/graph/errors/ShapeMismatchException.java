package dev.neuronic.graph.errors;

public class ShapeMismatchException extends FeedException {

    public ShapeMismatchException(String valueName, String message) {
        super(valueName, message);
    }
}
