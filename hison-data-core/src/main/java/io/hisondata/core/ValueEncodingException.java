package io.hisondata.core;

/**
 * Jackson failed to encode or decode a value.
 */
public class ValueEncodingException extends HisonDataException {

    public ValueEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
