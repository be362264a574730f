package io.hisondata.core;

/**
 * A validator, formatter or row filter was missing.
 */
public class InvalidFunctionException extends InvalidArgumentTypeException {

    public InvalidFunctionException(String message) {
        super(message);
    }
}
