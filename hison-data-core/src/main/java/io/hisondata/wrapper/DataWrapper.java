package io.hisondata.wrapper;

import io.hisondata.codec.ValueCodec;
import io.hisondata.core.HisonData;
import io.hisondata.core.InvalidArgumentTypeException;
import io.hisondata.core.NestedContainerException;
import io.hisondata.core.UndefinedValueException;
import io.hisondata.core.UnsupportedValueTypeException;
import io.hisondata.kernel.DataContainer;
import io.hisondata.kernel.Scalars;
import io.hisondata.kernel.Undefined;
import io.hisondata.storage.DataTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flat string-keyed container whose values are strings, {@code null}, or tables.
 * <p>
 * Scalars are coerced to strings on the way in. Tables are stored as independent clones and
 * handed out as clones, so nothing returned by a wrapper aliases its internal state.
 * Wrappers cannot be nested.
 * <pre>
 * DataWrapper request = new DataWrapper("status", "active");
 * request.putTable("users", users);
 * String body = request.getSerialized(); // {"status":"active","users":[...]}
 * </pre>
 * Instances are not thread-safe.
 */
public final class DataWrapper implements DataContainer {
    private final LinkedHashMap<String, Object> entries = new LinkedHashMap<>();
    private final ValueCodec codec;

    public DataWrapper() {
        this(HisonData.configuration().valueCodec());
    }

    /**
     * Create an empty wrapper that serializes through {@code codec}.
     */
    public DataWrapper(ValueCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec required");
        }
        this.codec = codec;
    }

    public DataWrapper(String key, Object value) {
        this();
        put(key, value);
    }

    /**
     * Create a wrapper holding every entry of {@code values}, in iteration order.
     */
    public DataWrapper(Map<String, ?> values) {
        this();
        if (values == null) {
            throw new InvalidArgumentTypeException("values required");
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            put(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Returns an independent copy; stored tables are cloned.
     */
    @Override
    public DataWrapper clone() {
        DataWrapper copy = new DataWrapper(codec);
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            copy.entries.put(entry.getKey(), copyOf(entry.getValue()));
        }
        return copy;
    }

    public DataWrapper clear() {
        entries.clear();
        return this;
    }

    /**
     * JSON object of the entries, with every table written as its array of rows.
     */
    @Override
    public String getSerialized() {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            Object value = entry.getValue();
            payload.put(entry.getKey(), value instanceof DataTable table ? table.getRows() : value);
        }
        return codec.writeString(payload);
    }

    /**
     * Plain snapshot of the entries, with every table expanded to its
     * {@link DataTable#getObject()} structure.
     */
    @Override
    public Map<String, Object> getObject() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            Object value = entry.getValue();
            snapshot.put(entry.getKey(), value instanceof DataTable table ? table.getObject() : value);
        }
        return snapshot;
    }

    // Writes

    /**
     * Store a scalar (as its string form), {@code null}, or a clone of a table.
     * Mutable numbers such as atomics are stored as the text of their current value.
     *
     * @throws NestedContainerException if {@code value} is a wrapper
     * @throws UnsupportedValueTypeException if {@code value} is any other type
     */
    public DataWrapper put(String key, Object value) {
        String validKey = validKey(key);
        if (value instanceof DataTable table) {
            entries.put(validKey, table.clone());
            return this;
        }
        entries.put(validKey, text(validKey, value));
        return this;
    }

    /**
     * Store a scalar or {@code null}; tables are refused.
     */
    public DataWrapper putString(String key, Object value) {
        String validKey = validKey(key);
        if (value instanceof DataTable) {
            throw new UnsupportedValueTypeException("only string-convertible values can be stored with putString. key: "
                    + validKey);
        }
        entries.put(validKey, text(validKey, value));
        return this;
    }

    public DataWrapper putTable(String key, DataTable value) {
        String validKey = validKey(key);
        if (value == null) {
            throw new UnsupportedValueTypeException("a table is required. key: " + validKey);
        }
        entries.put(validKey, value.clone());
        return this;
    }

    /**
     * Remove a key.
     *
     * @return the stored string or table, or {@code null} if the key was absent
     */
    public Object remove(String key) {
        return entries.remove(validKey(key));
    }

    // Reads

    /**
     * The stored string, a clone of the stored table, or {@code null} when absent.
     */
    public Object get(String key) {
        return copyOf(entries.get(validKey(key)));
    }

    /**
     * @return the stored string, or {@code null} when absent or stored as {@code null}
     * @throws UnsupportedValueTypeException if the key holds a table
     */
    public String getString(String key) {
        String validKey = validKey(key);
        Object value = entries.get(validKey);
        if (value instanceof DataTable) {
            throw new UnsupportedValueTypeException("the value is a table, not a string. key: " + validKey);
        }
        return (String) value;
    }

    /**
     * @return a clone of the stored table
     * @throws UnsupportedValueTypeException if the key is absent or does not hold a table
     */
    public DataTable getTable(String key) {
        String validKey = validKey(key);
        Object value = entries.get(validKey);
        if (!(value instanceof DataTable table)) {
            throw new UnsupportedValueTypeException("the wrapper holds no table under key: " + validKey);
        }
        return table.clone();
    }

    public boolean containsKey(String key) {
        return entries.containsKey(validKey(key));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    /**
     * Stored values in key order; tables are cloned.
     */
    public List<Object> values() {
        List<Object> values = new ArrayList<>(entries.size());
        for (Object value : entries.values()) {
            values.add(copyOf(value));
        }
        return values;
    }

    @Override
    public String toString() {
        return "DataWrapper{keys=" + entries.keySet() + '}';
    }

    private static String validKey(String key) {
        if (key == null) {
            throw new InvalidArgumentTypeException("a key must be a non-null string");
        }
        return key;
    }

    private static String text(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Undefined) {
            throw new UndefinedValueException("an undefined value cannot be stored; use null instead. key: " + key);
        }
        if (value instanceof DataContainer) {
            throw new NestedContainerException("a " + value.getClass().getSimpleName()
                    + " cannot be stored inside a wrapper. key: " + key);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Number number) {
            return Scalars.toText(Scalars.snapshot(number));
        }
        if (!Scalars.isScalar(value)) {
            throw new UnsupportedValueTypeException("only strings, numbers, booleans, enums, null or tables can be stored. key: "
                    + key + ", type: " + value.getClass().getName());
        }
        return Scalars.toText(value);
    }

    private static Object copyOf(Object value) {
        return value instanceof DataTable table ? table.clone() : value;
    }
}
