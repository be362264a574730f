package io.hisondata.core;

/**
 * How a table decides the kind a new column value must match.
 */
public enum TypeCheckMode {
    /**
     * Compare against the nearest earlier row holding a non-null value in the column.
     * Rows after the one being written are not consulted, so a column can drift in kind
     * once earlier rows are removed or reordered.
     */
    BACKWARD_SCAN,

    /**
     * The first non-null value stored in a column fixes its kind. The kind is released
     * when the column is removed, the table is cleared, or the whole column is rewritten.
     */
    DECLARED_KIND
}
