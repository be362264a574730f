package io.hisondata.core;

/**
 * A parameter received a value of the wrong kind, such as a {@code null} key or a
 * non-scalar column name.
 */
public class InvalidArgumentTypeException extends HisonDataException {

    public InvalidArgumentTypeException(String message) {
        super(message);
    }
}
