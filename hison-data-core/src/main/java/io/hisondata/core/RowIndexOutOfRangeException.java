package io.hisondata.core;

/**
 * A row index fell outside {@code [0, rowCount)}, or {@code [0, rowCount]} for inserts.
 */
public class RowIndexOutOfRangeException extends HisonDataException {
    private final int index;
    private final int rowCount;

    public RowIndexOutOfRangeException(int index, int rowCount) {
        super("row index " + index + " out of range, row count: " + rowCount);
        this.index = index;
        this.rowCount = rowCount;
    }

    public int index() {
        return index;
    }

    public int rowCount() {
        return rowCount;
    }
}
