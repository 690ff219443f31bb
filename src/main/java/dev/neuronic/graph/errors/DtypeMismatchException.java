package dev.neuronic.graph.errors;

public class DtypeMismatchException extends FeedException {

    public DtypeMismatchException(String valueName, String message, Throwable cause) {
        super(valueName, message, cause);
    }
}
