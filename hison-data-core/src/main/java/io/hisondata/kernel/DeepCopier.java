package io.hisondata.kernel;

import io.hisondata.core.HisonDataConfiguration;
import io.hisondata.core.NestedContainerException;
import io.hisondata.core.converter.ValueConverter;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Recursive value cloner. The copy shares no mutable state with the source.
 * <ul>
 *   <li>{@code null}, scalars and {@link Undefined} are returned as-is.</li>
 *   <li>{@link List}s become {@link ArrayList}s and {@link Map}s become
 *       {@link LinkedHashMap}s, copied element by element.</li>
 *   <li>Anything else goes through the {@link ValueConverter}; a non-null replacement
 *       is used verbatim, otherwise the original reference is kept. A mutable
 *       {@link Number} the converter declines is replaced by a snapshot of its value.</li>
 * </ul>
 * Sources are tracked by identity while copying, so cycles terminate and a sub-object
 * shared inside the source stays shared inside the copy.
 */
public final class DeepCopier {
    private final ValueConverter converter;

    public DeepCopier(ValueConverter converter) {
        this.converter = Objects.requireNonNull(converter, "converter");
    }

    public static DeepCopier of(HisonDataConfiguration configuration) {
        return new DeepCopier(configuration.valueConverter());
    }

    /**
     * Copy a value.
     *
     * @throws NestedContainerException if a table or wrapper is found at any depth
     */
    public Object copy(Object value) {
        return copy(value, new IdentityHashMap<>());
    }

    /**
     * Copy a row or any other string-keyed map.
     */
    @SuppressWarnings("unchecked")
    public LinkedHashMap<String, Object> copyRecord(Map<String, ?> record) {
        return (LinkedHashMap<String, Object>) copy(record, new IdentityHashMap<>());
    }

    private Object copy(Object value, IdentityHashMap<Object, Object> visited) {
        if (value == null || value instanceof Undefined || Scalars.isScalar(value)) {
            return value;
        }
        if (value instanceof DataContainer) {
            throw new NestedContainerException("a table or wrapper cannot be stored inside another container: "
                    + value.getClass().getSimpleName());
        }
        if (!(value instanceof List) && !(value instanceof Map)) {
            Object replacement = converter.convert(value);
            if (replacement != null) {
                return replacement;
            }
            return value instanceof Number number ? Scalars.snapshot(number) : value;
        }
        Object existing = visited.get(value);
        if (existing != null) {
            return existing;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            visited.put(value, copy);
            for (Object element : list) {
                copy.add(copy(element, visited));
            }
            return copy;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        Map<Object, Object> copy = new LinkedHashMap<>(Math.max(16, map.size() * 2));
        visited.put(value, copy);
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(entry.getKey(), copy(entry.getValue(), visited));
        }
        return copy;
    }
}
