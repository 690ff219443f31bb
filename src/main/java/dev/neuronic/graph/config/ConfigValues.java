package dev.neuronic.graph.config;

import dev.neuronic.graph.Shape;
import dev.neuronic.graph.errors.ConfigurationException;

import java.util.List;
import java.util.Map;

/**
 * Typed reads from a layer configuration map. Missing or mistyped entries raise
 * {@link ConfigurationException} naming the key.
 */
public final class ConfigValues {

    private ConfigValues() {}

    public static String string(Map<String, Object> config, String key) {
        return require(config, key, String.class);
    }

    public static String string(Map<String, Object> config, String key, String defaultValue) {
        return config.containsKey(key) ? string(config, key) : defaultValue;
    }

    public static int integer(Map<String, Object> config, String key) {
        return require(config, key, Number.class).intValue();
    }

    public static int integer(Map<String, Object> config, String key, int defaultValue) {
        return config.containsKey(key) ? integer(config, key) : defaultValue;
    }

    public static float decimal(Map<String, Object> config, String key) {
        return require(config, key, Number.class).floatValue();
    }

    public static float decimal(Map<String, Object> config, String key, float defaultValue) {
        return config.containsKey(key) ? decimal(config, key) : defaultValue;
    }

    public static boolean bool(Map<String, Object> config, String key, boolean defaultValue) {
        return config.containsKey(key) ? require(config, key, Boolean.class) : defaultValue;
    }

    /**
     * Optional seed; absent means unseeded.
     */
    public static Long seed(Map<String, Object> config, String key) {
        return config.containsKey(key) ? Long.valueOf(require(config, key, Number.class).longValue()) : null;
    }

    public static Shape shape(Map<String, Object> config, String key) {
        List<?> dims = require(config, key, List.class);
        int[] result = new int[dims.size()];
        for (int i = 0; i < result.length; i++) {
            if (!(dims.get(i) instanceof Number))
                throw new ConfigurationException("Config entry '" + key + "' must be a list of integers, got " + dims);
            result[i] = ((Number) dims.get(i)).intValue();
        }
        return Shape.of(result);
    }

    public static List<Integer> dims(Shape shape) {
        int[] dims = shape.dims();
        Integer[] boxed = new Integer[dims.length];
        for (int i = 0; i < dims.length; i++)
            boxed[i] = dims[i];
        return List.of(boxed);
    }

    private static <T> T require(Map<String, Object> config, String key, Class<T> type) {
        Object value = config.get(key);
        if (value == null)
            throw new ConfigurationException("Missing config entry '" + key + "' in " + config);
        if (!type.isInstance(value))
            throw new ConfigurationException("Config entry '" + key + "' must be a " + type.getSimpleName()
                + ", got " + value.getClass().getSimpleName());
        return type.cast(value);
    }
}
