package dev.neuronic.graph.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Non-tensor arguments recorded with a layer invocation, such as a {@code training} override.
 * Immutable.
 */
public final class CallArguments {

    public static final String TRAINING = "training";

    private static final CallArguments EMPTY = new CallArguments(Map.of());

    private final Map<String, Object> values;

    private CallArguments(Map<String, Object> values) {
        this.values = values;
    }

    public static CallArguments empty() {
        return EMPTY;
    }

    public static CallArguments of(Map<String, ?> values) {
        if (values == null || values.isEmpty())
            return EMPTY;
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (key == null || value == null)
                throw new IllegalArgumentException("Call arguments cannot contain null keys or values");
            copy.put(key, value);
        });
        return new CallArguments(Collections.unmodifiableMap(copy));
    }

    public static CallArguments training(boolean training) {
        return of(Map.of(TRAINING, training));
    }

    public CallArguments with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return of(copy);
    }

    /**
     * Explicit training override recorded for this call, if any.
     */
    public Optional<Boolean> training() {
        Object value = values.get(TRAINING);
        return value instanceof Boolean flag ? Optional.of(flag) : Optional.empty();
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CallArguments other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
