package io.hisondata.storage;

import java.util.List;
import java.util.Map;

/**
 * Detached copy of a table's columns and rows.
 *
 * @param columns column names in display order
 * @param rows row records, each keyed in column order
 * @param columnCount number of columns
 * @param rowCount number of rows
 * @param declared whether any column is declared
 */
public record TableSnapshot(List<String> columns,
                            List<Map<String, Object>> rows,
                            int columnCount,
                            int rowCount,
                            boolean declared) {
}
