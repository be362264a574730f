package io.hisondata.kernel;

import io.hisondata.codec.ValueCodec;
import io.hisondata.core.SortTypeException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders column values for row sorting.
 * <p>
 * Values of different families are ordered by family first: numbers, then strings, then
 * booleans, then structured values. Within a family numbers compare numerically, strings
 * lexicographically, booleans with {@code false} first and structured values by their
 * canonical encoding. Integer ordering parses every value's leading integer and fails when
 * there is none.
 */
public final class ValueOrdering implements Comparator<Object> {
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final int RANK_NUMBER = 0;
    private static final int RANK_STRING = 1;
    private static final int RANK_BOOLEAN = 2;
    private static final int RANK_STRUCTURED = 3;

    private final ValueCodec codec;
    private final boolean integerOrder;

    public ValueOrdering(ValueCodec codec, boolean integerOrder) {
        this.codec = codec;
        this.integerOrder = integerOrder;
    }

    /**
     * Ascending order with {@code null} after every non-null value.
     */
    public Comparator<Object> nullsLast() {
        return Comparator.nullsLast(this);
    }

    /**
     * Descending order with {@code null} before every non-null value.
     */
    public Comparator<Object> reversedNullsFirst() {
        return Comparator.nullsFirst(this.reversed());
    }

    @Override
    public int compare(Object a, Object b) {
        if (integerOrder) {
            return leadingInteger(plain(a)).compareTo(leadingInteger(plain(b)));
        }
        int byFamily = Integer.compare(rank(a), rank(b));
        if (byFamily != 0) {
            return byFamily;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return compareNumbers(x, y);
        }
        if (a instanceof Boolean x && b instanceof Boolean y) {
            return Boolean.compare(x, y);
        }
        return plain(a).toString().compareTo(plain(b).toString());
    }

    private Object plain(Object value) {
        return isStructured(value) ? codec.canonical(value) : value;
    }

    private static int rank(Object value) {
        ValueKind kind = ValueKind.of(value);
        if (kind == null) {
            throw new IllegalArgumentException("null values are ordered by the nulls-first or nulls-last wrapper");
        }
        return switch (kind.category()) {
            case NUMBER, BIG_INTEGER -> RANK_NUMBER;
            case STRING -> RANK_STRING;
            case BOOLEAN -> RANK_BOOLEAN;
            case ARRAY, RECORD, OPAQUE -> RANK_STRUCTURED;
        };
    }

    private static boolean isStructured(Object value) {
        ValueKind kind = ValueKind.of(value);
        return kind != null && kind.isStructured();
    }

    private static int compareNumbers(Number x, Number y) {
        BigDecimal left = exact(x);
        BigDecimal right = exact(y);
        if (left == null || right == null) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        return left.compareTo(right);
    }

    private static BigDecimal exact(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : BigDecimal.valueOf(d);
        }
        return BigDecimal.valueOf(number.longValue());
    }

    static BigInteger leadingInteger(Object value) {
        if (value instanceof Number number) {
            BigDecimal decimal = exact(number);
            if (decimal != null) {
                return decimal.setScale(0, RoundingMode.DOWN).toBigIntegerExact();
            }
        } else if (value instanceof String || value instanceof Character) {
            Matcher matcher = LEADING_INTEGER.matcher(value.toString());
            if (matcher.find()) {
                return new BigInteger(matcher.group(1));
            }
        }
        throw new SortTypeException("cannot sort rows by integer order: non-integer value " + value);
    }
}
