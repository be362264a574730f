package io.hisondata.core;

/**
 * A value is neither convertible to a string nor a table, where one of those is required.
 */
public class UnsupportedValueTypeException extends HisonDataException {

    public UnsupportedValueTypeException(String message) {
        super(message);
    }
}
