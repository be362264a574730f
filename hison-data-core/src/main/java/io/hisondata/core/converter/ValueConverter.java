package io.hisondata.core.converter;

/**
 * Conversion hook consulted when a value is neither a scalar, a {@link java.util.List}
 * nor a {@link java.util.Map}.
 * <p>
 * A non-null result replaces the original and is stored verbatim; it is treated as
 * immutable and is not copied again. A {@code null} result keeps the original reference.
 * <pre>
 * HisonData.configure(HisonDataConfiguration.builder()
 *     .valueConverter(value -&gt; value instanceof Date d ? d.getTime() : null)
 *     .build());
 * </pre>
 */
@FunctionalInterface
public interface ValueConverter {

    /**
     * Convert an opaque value.
     *
     * @param value the value being copied, never {@code null}
     * @return the replacement, or {@code null} to keep {@code value} unchanged
     */
    Object convert(Object value);

    /**
     * The default hook: every value passes through unchanged.
     */
    static ValueConverter identity() {
        return value -> null;
    }
}
