package io.hisondata.core;

/**
 * {@link io.hisondata.kernel.Undefined#VALUE} was passed where a concrete value
 * (including {@code null}) is required.
 */
public class UndefinedValueException extends HisonDataException {

    public UndefinedValueException(String message) {
        super(message);
    }
}
