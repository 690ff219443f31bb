package dev.neuronic.graph;

import java.util.HashMap;
import java.util.Map;

/**
 * Naming context that hands out unique layer names such as {@code dense_1}, {@code dense_2}.
 *
 * <p>Create one scope per top-level model construction and pass it to the {@code Layers}
 * factory or {@code Sequential} builder. Two scopes never influence each other, so building the
 * same model twice with fresh scopes yields identical names, which keeps weight names stable.
 *
 * <p>Thread-safe.
 */
public final class NameScope {

    private final String prefix;
    private final Map<String, Integer> counters = new HashMap<>();

    public NameScope() {
        this("");
    }

    /**
     * @param prefix prepended to every generated name, e.g. {@code "encoder/"}
     */
    public NameScope(String prefix) {
        if (prefix == null)
            throw new IllegalArgumentException("prefix must not be null");
        this.prefix = prefix;
    }

    /**
     * Next unique name for the given base, e.g. {@code uniqueName("dense")} returns
     * {@code "dense_1"} on the first call.
     */
    public synchronized String uniqueName(String base) {
        if (base == null || base.isEmpty())
            throw new IllegalArgumentException("base name must not be empty");
        int next = counters.merge(base, 1, Integer::sum);
        return prefix + base + "_" + next;
    }

    /**
     * Marks a user-chosen name as taken so later generated names do not collide with it when it
     * has the {@code base_N} form.
     */
    public synchronized void reserve(String name) {
        int underscore = name.lastIndexOf('_');
        if (underscore <= prefix.length() || underscore == name.length() - 1 || !name.startsWith(prefix))
            return;
        String suffix = name.substring(underscore + 1);
        if (suffix.length() > 9 || !suffix.chars().allMatch(Character::isDigit))
            return;
        String base = name.substring(prefix.length(), underscore);
        counters.merge(base, Integer.parseInt(suffix), Math::max);
    }

    public String prefix() {
        return prefix;
    }
}
