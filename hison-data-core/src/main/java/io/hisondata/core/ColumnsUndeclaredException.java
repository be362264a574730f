package io.hisondata.core;

/**
 * An operation needed declared columns but the table has none.
 */
public class ColumnsUndeclaredException extends HisonDataException {

    public ColumnsUndeclaredException(String message) {
        super(message);
    }
}
