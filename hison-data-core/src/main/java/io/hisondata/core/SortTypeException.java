package io.hisondata.core;

/**
 * An integer-ordered row sort met a value that does not parse as an integer.
 */
public class SortTypeException extends HisonDataException {

    public SortTypeException(String message) {
        super(message);
    }
}
