package dev.neuronic.graph.errors;

/**
 * A graph input needed by the requested fetches has no value in the feed.
 */
public class MissingFeedException extends FeedException {

    public MissingFeedException(String valueName) {
        super(valueName, "Missing a feed value for graph input '" + valueName + "'");
    }
}
