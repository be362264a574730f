package io.hisondata.kernel;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Runtime category of a value, used for per-column type consistency.
 * <p>
 * Scalars are grouped by primitive family, so {@code 1} and {@code 2.5} share the
 * {@code number} kind. Lists and maps are {@code array} and {@code record}; any other
 * value's kind is its runtime class.
 *
 * @param category the family
 * @param type the runtime class for {@link Category#OPAQUE}, otherwise {@code null}
 */
public record ValueKind(Category category, Class<?> type) {

    public static final ValueKind STRING = new ValueKind(Category.STRING, null);
    public static final ValueKind NUMBER = new ValueKind(Category.NUMBER, null);
    public static final ValueKind BOOLEAN = new ValueKind(Category.BOOLEAN, null);
    public static final ValueKind BIG_INTEGER = new ValueKind(Category.BIG_INTEGER, null);
    public static final ValueKind ARRAY = new ValueKind(Category.ARRAY, null);
    public static final ValueKind RECORD = new ValueKind(Category.RECORD, null);

    public enum Category {
        STRING,
        NUMBER,
        BOOLEAN,
        BIG_INTEGER,
        ARRAY,
        RECORD,
        OPAQUE
    }

    public ValueKind {
        if (category == null) {
            throw new IllegalArgumentException("category required");
        }
        if ((category == Category.OPAQUE) != (type != null)) {
            throw new IllegalArgumentException("type required for opaque kinds only");
        }
    }

    /**
     * Classify a value.
     *
     * @return the kind, or {@code null} for a {@code null} value
     */
    public static ValueKind of(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Character) {
            return STRING;
        }
        if (value instanceof BigInteger) {
            return BIG_INTEGER;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof List) {
            return ARRAY;
        }
        if (value instanceof Map) {
            return RECORD;
        }
        return new ValueKind(Category.OPAQUE, value.getClass());
    }

    public boolean isStructured() {
        return category == Category.ARRAY || category == Category.RECORD || category == Category.OPAQUE;
    }

    @Override
    public String toString() {
        return switch (category) {
            case STRING -> "string";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case BIG_INTEGER -> "bigint";
            case ARRAY -> "array";
            case RECORD -> "record";
            case OPAQUE -> type.getName();
        };
    }
}
