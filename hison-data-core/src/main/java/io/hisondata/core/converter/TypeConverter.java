package io.hisondata.core.converter;

/**
 * Converts one opaque Java type into the value a table stores for it.
 * Registered on a {@link ValueConverterRegistry}.
 *
 * @param <J> the Java type handled
 * @param <S> the stored type
 */
public interface TypeConverter<J, S> {

    /**
     * Get the Java type this converter handles.
     */
    Class<J> javaType();

    /**
     * Get the type produced by {@link #toStorage(Object)}.
     */
    Class<S> storageType();

    /**
     * Convert the Java value to the stored value.
     */
    S toStorage(J javaValue);
}
