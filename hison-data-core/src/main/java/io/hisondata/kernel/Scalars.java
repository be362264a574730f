package io.hisondata.kernel;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAccumulator;
import java.util.concurrent.atomic.LongAdder;

/**
 * Helpers for the scalar values a wrapper coerces to strings.
 */
public final class Scalars {
    private static final double MAX_EXACT_INTEGRAL = 1e15;

    private Scalars() {
    }

    /**
     * Strings, characters, booleans and the immutable JDK number types: boxed primitives,
     * {@link BigInteger} and {@link BigDecimal}. Other {@link Number}s, such as atomics and
     * adders, are mutable and are not scalars.
     */
    public static boolean isScalar(Object value) {
        return value instanceof String
                || value instanceof Boolean
                || value instanceof Character
                || isImmutableNumber(value);
    }

    private static boolean isImmutableNumber(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Double
                || value instanceof Float
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger
                || value instanceof BigDecimal;
    }

    /**
     * Immutable copy of a number's current value.
     * Long-valued atomics and accumulators become {@link Long}, double-valued ones
     * {@link Double}; any other number is read through its decimal text.
     */
    public static Number snapshot(Number number) {
        if (isImmutableNumber(number)) {
            return number;
        }
        if (number instanceof AtomicInteger
                || number instanceof AtomicLong
                || number instanceof LongAdder
                || number instanceof LongAccumulator) {
            return number.longValue();
        }
        if (number instanceof DoubleAdder || number instanceof DoubleAccumulator) {
            return number.doubleValue();
        }
        String text = number.toString();
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            // not a decimal literal, so only the double view is reliable
            return number.doubleValue();
        }
    }

    /**
     * Coerce a scalar to text. Integral floating-point values print without a fraction,
     * so {@code 25.0} becomes {@code "25"}.
     *
     * @throws IllegalArgumentException if the value is not a scalar
     */
    public static String toText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < MAX_EXACT_INTEGRAL) {
                return Long.toString((long) d);
            }
            return value.toString();
        }
        if (isScalar(value)) {
            return value.toString();
        }
        throw new IllegalArgumentException("not a scalar: " + (value == null ? "null" : value.getClass().getName()));
    }
}
