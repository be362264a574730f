package io.hisondata.codec;

/**
 * JSON codec used for canonical value encoding and payload serialization.
 * <p>
 * Two values are structurally equal for search, duplicate detection and sorting
 * exactly when their {@link #canonical(Object)} encodings are equal.
 */
public interface ValueCodec {

    /**
     * Serialize a value to a JSON string.
     *
     * @throws io.hisondata.core.ValueEncodingException if the value cannot be encoded
     */
    String writeString(Object value);

    /**
     * Parse a JSON document into maps, lists and scalars.
     *
     * @throws io.hisondata.core.ValueEncodingException if the document is malformed
     */
    Object readValue(String json);

    /**
     * Deterministic encoding used to compare values.
     */
    default String canonical(Object value) {
        return writeString(value);
    }
}
