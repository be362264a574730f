package io.hisondata.core;

/**
 * A value conflicts with the kind already established for its column.
 */
public class TypeConsistencyException extends HisonDataException {

    public TypeConsistencyException(String message) {
        super(message);
    }
}
