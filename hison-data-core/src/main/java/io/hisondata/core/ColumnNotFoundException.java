package io.hisondata.core;

/**
 * The named column is not declared on the table.
 */
public class ColumnNotFoundException extends HisonDataException {

    public ColumnNotFoundException(String message) {
        super(message);
    }
}
