package dev.neuronic.graph.exec;

import dev.neuronic.graph.Tensor;
import dev.neuronic.graph.errors.DtypeMismatchException;
import dev.neuronic.graph.errors.DuplicateKeyException;
import dev.neuronic.graph.errors.MissingKeyException;
import dev.neuronic.graph.errors.ShapeMismatchException;
import dev.neuronic.graph.topology.SymbolicValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapping from symbolic values to the concrete tensors that seed an execution.
 *
 * <p>Keys are symbolic value ids; each id may be fed at most once. Values are checked against
 * the key's declared shape (rank and every known dimension) and type when added. A value of a
 * different but castable type is cast, and the cast is logged; other type mismatches are
 * rejected.
 *
 * <p>Not thread-safe. Build one per execution call.
 */
public class FeedDict {

    private static final Logger LOG = LoggerFactory.getLogger(FeedDict.class);

    private final Map<Integer, Tensor> id2Value = new LinkedHashMap<>();
    private final Map<Integer, String> id2Name = new LinkedHashMap<>();

    public FeedDict() {
    }

    public FeedDict(List<Feed> feeds) {
        for (Feed feed : feeds)
            add(feed);
    }

    /**
     * Copy constructor. Shares the tensors of {@code other}; later additions to either dict do
     * not affect the other.
     */
    public FeedDict(FeedDict other) {
        id2Value.putAll(other.id2Value);
        id2Name.putAll(other.id2Name);
    }

    /**
     * @return this dict
     * @throws DuplicateKeyException   if the key was already fed
     * @throws ShapeMismatchException  if the value's shape contradicts the key's shape
     * @throws DtypeMismatchException  if the value cannot be cast to the key's type
     */
    public FeedDict add(SymbolicValue key, Tensor value) {
        if (id2Value.containsKey(key.getId()))
            throw new DuplicateKeyException(key.getName(), key.getId());
        id2Value.put(key.getId(), assertFeedCompatibility(key, value));
        id2Name.put(key.getId(), key.getName());
        return this;
    }

    public FeedDict add(Feed feed) {
        return add(feed.key(), feed.value());
    }

    private static Tensor assertFeedCompatibility(SymbolicValue key, Tensor value) {
        int rank = key.getShape().rank();
        if (value.rank() != rank)
            throw new ShapeMismatchException(key.getName(), "The rank of feed (" + value.rank()
                + ") does not match the rank of the key '" + key.getName() + "' (" + rank + ").");
        for (int i = 0; i < rank; i++) {
            if (key.getShape().isKnown(i) && key.getShape().dim(i) != value.shape().dim(i))
                throw new ShapeMismatchException(key.getName(), "The " + i + "-th dimension of the feed ("
                    + value.shape().dim(i) + ") is incompatible with that of the key '" + key.getName()
                    + "' (" + key.getShape().dim(i) + ").");
        }

        if (key.getDtype() == value.dtype())
            return value;
        try {
            Tensor cast = value.cast(key.getDtype());
            LOG.info("Cast feed value for '{}' from {} to {}", key.getName(), value.dtype(), key.getDtype());
            return cast;
        } catch (IllegalArgumentException e) {
            throw new DtypeMismatchException(key.getName(), "The dtype of the feed (" + value.dtype()
                + ") can not be cast to the dtype of the key '" + key.getName() + "' (" + key.getDtype() + ").", e);
        }
    }

    public boolean hasKey(SymbolicValue key) {
        return id2Value.containsKey(key.getId());
    }

    /**
     * @throws MissingKeyException if the key has no value
     */
    public Tensor getValue(SymbolicValue key) {
        Tensor value = id2Value.get(key.getId());
        if (value == null)
            throw new MissingKeyException(key.getName());
        return value;
    }

    public boolean hasName(String name) {
        for (String fedName : id2Name.values()) {
            if (fedName.equals(name))
                return true;
        }
        return false;
    }

    /**
     * @throws MissingKeyException if no fed value has that name
     */
    public Tensor getValueByName(String name) {
        for (Map.Entry<Integer, String> entry : id2Name.entrySet()) {
            if (entry.getValue().equals(name))
                return id2Value.get(entry.getKey());
        }
        throw new MissingKeyException(name);
    }

    /**
     * Names of all fed values, in insertion order.
     */
    public List<String> names() {
        return new ArrayList<>(id2Name.values());
    }

    public int size() {
        return id2Value.size();
    }

    public boolean isEmpty() {
        return id2Value.isEmpty();
    }

    /**
     * Drops a value so its tensor can be reclaimed. Used by the executor for transient values.
     */
    void release(SymbolicValue key) {
        id2Value.remove(key.getId());
        id2Name.remove(key.getId());
    }

    @Override
    public String toString() {
        return "FeedDict" + names();
    }
}
