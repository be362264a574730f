package io.hisondata.core;

/**
 * A column name was declared twice.
 */
public class DuplicateColumnException extends HisonDataException {

    public DuplicateColumnException(String message) {
        super(message);
    }
}
