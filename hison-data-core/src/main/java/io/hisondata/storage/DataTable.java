package io.hisondata.storage;

import io.hisondata.codec.ValueCodec;
import io.hisondata.core.ColumnNotFoundException;
import io.hisondata.core.ColumnsUndeclaredException;
import io.hisondata.core.DuplicateColumnException;
import io.hisondata.core.HisonData;
import io.hisondata.core.HisonDataConfiguration;
import io.hisondata.core.InvalidArgumentTypeException;
import io.hisondata.core.InvalidFunctionException;
import io.hisondata.core.NestedContainerException;
import io.hisondata.core.RowIndexOutOfRangeException;
import io.hisondata.core.UndefinedValueException;
import io.hisondata.kernel.DataContainer;
import io.hisondata.kernel.DeepCopier;
import io.hisondata.kernel.Scalars;
import io.hisondata.kernel.Undefined;
import io.hisondata.kernel.ValueOrdering;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered columns plus ordered rows, with per-column type consistency and no static schema.
 * <p>
 * Every row holds exactly one entry per declared column; missing entries are {@code null}.
 * Values are deep-copied on the way in and on the way out, so callers never share mutable
 * state with the table. A table or wrapper can never be stored as a value.
 * <p>
 * A table is <em>undeclared</em> until its first column is added, either explicitly or from
 * the keys of the first inserted row. {@link #clear()} returns it to the undeclared state.
 * <pre>
 * DataTable users = new DataTable(List.of(
 *     Map.of("id", 1, "name", "Alice"),
 *     Map.of("id", 2, "name", "Bob")));
 * users.sortRowDescending("id").getRow(0); // {id=2, name=Bob}
 * </pre>
 * Instances are not thread-safe.
 */
public final class DataTable implements DataContainer {
    private static final Logger LOG = LoggerFactory.getLogger(DataTable.class);

    private final HisonDataConfiguration configuration;
    private final DeepCopier copier;
    private final ValueCodec codec;
    private final ColumnKindTracker kinds;
    private final List<String> columns = new ArrayList<>();
    private final List<LinkedHashMap<String, Object>> rows = new ArrayList<>();

    public DataTable() {
        this(HisonData.configuration());
    }

    public DataTable(HisonDataConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
        this.copier = DeepCopier.of(configuration);
        this.codec = configuration.valueCodec();
        this.kinds = new ColumnKindTracker(configuration.typeCheckMode());
    }

    /**
     * Create a table holding one row; its keys declare the columns.
     */
    public DataTable(Map<String, ?> row) {
        this(row, HisonData.configuration());
    }

    public DataTable(Map<String, ?> row, HisonDataConfiguration configuration) {
        this(configuration);
        if (row != null) {
            insertRow(rows.size(), row);
        }
    }

    /**
     * Create a table from a list of row maps, or declare columns from a list of names.
     * The first element decides: a scalar or {@code null} means column names.
     */
    public DataTable(List<?> data) {
        this(data, HisonData.configuration());
    }

    public DataTable(List<?> data, HisonDataConfiguration configuration) {
        this(configuration);
        if (data != null) {
            put(data);
        }
    }

    /**
     * Create an independent copy of another table.
     */
    public DataTable(DataTable source) {
        this(requireSource(source).configuration);
        copyFrom(source, allRowIndexes(source));
    }

    public HisonDataConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Returns an independent deep copy. Columns and column order carry over, even when
     * there are no rows.
     */
    @Override
    public DataTable clone() {
        return new DataTable(this);
    }

    /**
     * Remove every column and row, returning the table to the undeclared state.
     */
    public DataTable clear() {
        columns.clear();
        rows.clear();
        kinds.clear();
        return this;
    }

    /**
     * JSON array of the rows, each keyed in column order.
     */
    @Override
    public String getSerialized() {
        List<Map<String, Object>> ordered = new ArrayList<>(rows.size());
        for (LinkedHashMap<String, Object> row : rows) {
            ordered.add(ordered(row));
        }
        return codec.writeString(ordered);
    }

    public boolean isDeclared() {
        return !columns.isEmpty();
    }

    public List<String> getColumns() {
        return new ArrayList<>(columns);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /**
     * Copies of one column's values, in row order.
     */
    public List<Object> getColumnValues(String column) {
        String name = existingColumn(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (LinkedHashMap<String, Object> row : rows) {
            values.add(copier.copy(row.get(name)));
        }
        return values;
    }

    // Column declaration

    /**
     * Declare a column and backfill {@code null} into every existing row.
     *
     * @throws DuplicateColumnException if the column already exists
     */
    public DataTable addColumn(String column) {
        String name = declareColumn(column);
        for (LinkedHashMap<String, Object> row : rows) {
            row.putIfAbsent(name, null);
        }
        return this;
    }

    public DataTable addColumns(List<String> names) {
        if (names == null) {
            throw new InvalidArgumentTypeException("column names required");
        }
        for (String column : names) {
            addColumn(column);
        }
        return this;
    }

    /**
     * Delete a column from the declaration and from every row.
     *
     * @throws ColumnNotFoundException if the column is not declared
     */
    public DataTable removeColumn(String column) {
        String name = existingColumn(column);
        for (LinkedHashMap<String, Object> row : rows) {
            row.remove(name);
        }
        columns.remove(name);
        kinds.release(name);
        return this;
    }

    public DataTable removeColumns(List<String> names) {
        if (names == null) {
            throw new InvalidArgumentTypeException("column names required");
        }
        for (String column : names) {
            removeColumn(column);
        }
        return this;
    }

    /**
     * Keep only the listed columns. Listed names that are not declared are ignored.
     */
    public DataTable setValidColumns(List<String> names) {
        if (names == null) {
            throw new InvalidArgumentTypeException("column names required");
        }
        List<String> removed = new ArrayList<>();
        for (String column : columns) {
            if (!names.contains(column)) {
                removed.add(column);
            }
        }
        return removeColumns(removed);
    }

    // Rows

    /**
     * Append a row of {@code null} values.
     *
     * @throws ColumnsUndeclaredException if no column is declared
     */
    public DataTable addRow() {
        return addRow(rows.size());
    }

    /**
     * Insert a row of {@code null} values at {@code index}; {@code index == rowCount} appends.
     */
    public DataTable addRow(int index) {
        if (columns.isEmpty()) {
            throw new ColumnsUndeclaredException("declare columns before adding an empty row");
        }
        int position = insertIndex(index);
        LinkedHashMap<String, Object> empty = new LinkedHashMap<>();
        for (String column : columns) {
            empty.put(column, null);
        }
        rows.add(position, empty);
        return this;
    }

    /**
     * Append a row. On an undeclared table the row's keys declare the columns; otherwise
     * undeclared keys are ignored and missing columns are set to {@code null}.
     */
    public DataTable addRow(Map<String, ?> row) {
        insertRow(rows.size(), row);
        return this;
    }

    public DataTable addRow(int index, Map<String, ?> row) {
        insertRow(insertIndex(index), row);
        return this;
    }

    /**
     * Append rows, or declare columns from a list of names.
     */
    public DataTable addRows(List<?> data) {
        if (data == null) {
            throw new InvalidArgumentTypeException("rows required");
        }
        put(data);
        return this;
    }

    public Map<String, Object> getRow(int index) {
        return copyRow(validRowIndex(index));
    }

    public DataTable getRowAsTable(int index) {
        return derive(List.of(validRowIndex(index)));
    }

    /**
     * Copies of every row.
     */
    public List<Map<String, Object>> getRows() {
        return getRows(0);
    }

    /**
     * Copies of the rows from {@code start} to the last row.
     */
    public List<Map<String, Object>> getRows(int start) {
        if (rows.isEmpty()) {
            return new ArrayList<>();
        }
        return getRows(start, rows.size() - 1);
    }

    /**
     * Copies of the rows from {@code start} to {@code end}, both inclusive.
     * A start after the end yields an empty list.
     */
    public List<Map<String, Object>> getRows(int start, int end) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (int index : rangeIndexes(start, end)) {
            result.add(copyRow(index));
        }
        return result;
    }

    public DataTable getRowsAsTable() {
        return getRowsAsTable(0);
    }

    public DataTable getRowsAsTable(int start) {
        if (rows.isEmpty()) {
            return derive(List.of());
        }
        return getRowsAsTable(start, rows.size() - 1);
    }

    public DataTable getRowsAsTable(int start, int end) {
        return derive(rangeIndexes(start, end));
    }

    /**
     * Remove the first row.
     */
    public Map<String, Object> removeRow() {
        return removeRow(0);
    }

    /**
     * Remove and return the row at {@code index}.
     */
    public Map<String, Object> removeRow(int index) {
        return ordered(rows.remove(validRowIndex(index)));
    }

    // Values

    public Object getValue(int index, String column) {
        String name = existingColumn(column);
        return copier.copy(rows.get(validRowIndex(index)).get(name));
    }

    /**
     * @throws UndefinedValueException if {@code value} is {@link Undefined#VALUE}
     * @throws io.hisondata.core.TypeConsistencyException if the value's kind conflicts with the column
     */
    public DataTable setValue(int index, String column, Object value) {
        rejectUndefined(value);
        String name = existingColumn(column);
        int rowIndex = validRowIndex(index);
        Object stored = validValue(rowIndex, name, value);
        rows.get(rowIndex).put(name, stored);
        kinds.stored(name, stored);
        return this;
    }

    /**
     * Assign one value to every row of a column, declaring the column when absent.
     */
    public DataTable setColumnSameValue(String column, Object value) {
        rejectUndefined(value);
        String name = validColumnName(column);
        if (!columns.contains(name)) {
            declareColumn(name);
        }
        kinds.release(name);
        for (int i = 0; i < rows.size(); i++) {
            Object stored = validValue(i, name, value);
            rows.get(i).put(name, stored);
            kinds.stored(name, stored);
        }
        return this;
    }

    /**
     * Replace every value of a column with {@code formatter}'s result for it.
     * Results are validated like any other write.
     */
    public DataTable setColumnSameFormat(String column, Function<Object, ?> formatter) {
        requireFunction(formatter);
        String name = existingColumn(column);
        kinds.release(name);
        for (int i = 0; i < rows.size(); i++) {
            Object formatted = formatter.apply(copier.copy(rows.get(i).get(name)));
            rejectUndefined(formatted);
            Object stored = validValue(i, name, formatted);
            rows.get(i).put(name, stored);
            kinds.stored(name, stored);
        }
        return this;
    }

    // Column checks

    public boolean isNotNullColumn(String column) {
        return firstNullRowIndex(column) < 0;
    }

    public Optional<Map<String, Object>> findFirstRowNullColumn(String column) {
        return rowAt(firstNullRowIndex(column));
    }

    public boolean isNotDuplColumn(String column) {
        return firstDuplicateRowIndex(column) < 0;
    }

    /**
     * The first row whose value in {@code column} already appeared in an earlier row.
     * {@code null} values never count as duplicates.
     */
    public Optional<Map<String, Object>> findFirstRowDuplColumn(String column) {
        return rowAt(firstDuplicateRowIndex(column));
    }

    public boolean isValidValue(String column, Predicate<Object> validator) {
        return firstInvalidRowIndex(column, validator) < 0;
    }

    public Optional<Map<String, Object>> findFirstRowInvalidValue(String column, Predicate<Object> validator) {
        return rowAt(firstInvalidRowIndex(column, validator));
    }

    // Search by condition

    public List<Integer> searchRowIndexes(Map<String, ?> condition) {
        return searchRowIndexes(condition, false);
    }

    /**
     * Indexes of the rows whose values equal every entry of {@code condition}, compared by
     * canonical encoding. With {@code negate} the complement is returned.
     */
    public List<Integer> searchRowIndexes(Map<String, ?> condition, boolean negate) {
        Map<String, String> expected = encodeCondition(condition);
        List<Integer> matched = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (matches(rows.get(i), expected) != negate) {
                matched.add(i);
            }
        }
        return matched;
    }

    public List<Map<String, Object>> searchRows(Map<String, ?> condition) {
        return searchRows(condition, false);
    }

    public List<Map<String, Object>> searchRows(Map<String, ?> condition, boolean negate) {
        return copyRows(searchRowIndexes(condition, negate));
    }

    public DataTable searchRowsAsTable(Map<String, ?> condition) {
        return searchRowsAsTable(condition, false);
    }

    public DataTable searchRowsAsTable(Map<String, ?> condition, boolean negate) {
        return derive(searchRowIndexes(condition, negate));
    }

    public DataTable searchAndModify(Map<String, ?> condition) {
        return searchAndModify(condition, false);
    }

    /**
     * Keep only matching rows, or with {@code negate} discard them.
     */
    public DataTable searchAndModify(Map<String, ?> condition, boolean negate) {
        retain(searchRowIndexes(condition, negate));
        return this;
    }

    // Search by predicate

    /**
     * Indexes of the rows accepted by {@code filter}. The filter sees a copy of each row.
     */
    public List<Integer> filterRowIndexes(Predicate<Map<String, Object>> filter) {
        requireFunction(filter);
        List<Integer> matched = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (filter.test(copyRow(i))) {
                matched.add(i);
            }
        }
        return matched;
    }

    public List<Map<String, Object>> filterRows(Predicate<Map<String, Object>> filter) {
        return copyRows(filterRowIndexes(filter));
    }

    public DataTable filterRowsAsTable(Predicate<Map<String, Object>> filter) {
        return derive(filterRowIndexes(filter));
    }

    /**
     * Keep only the rows accepted by {@code filter}.
     */
    public DataTable filterAndModify(Predicate<Map<String, Object>> filter) {
        retain(filterRowIndexes(filter));
        return this;
    }

    // Column order

    /**
     * Move the listed columns to the front in the given order; the others follow in their
     * current relative order.
     *
     * @throws ColumnNotFoundException if a listed column is not declared
     */
    public DataTable setColumnSorting(List<String> orderedNames) {
        if (orderedNames == null) {
            throw new InvalidArgumentTypeException("column names required");
        }
        Set<String> reordered = new LinkedHashSet<>();
        for (String column : orderedNames) {
            reordered.add(existingColumn(column));
        }
        reordered.addAll(columns);
        columns.clear();
        columns.addAll(reordered);
        return this;
    }

    public DataTable sortColumnAscending() {
        columns.sort(Comparator.naturalOrder());
        return this;
    }

    public DataTable sortColumnDescending() {
        columns.sort(Comparator.reverseOrder());
        return this;
    }

    public DataTable sortColumnReverse() {
        Collections.reverse(columns);
        return this;
    }

    // Row order

    public DataTable sortRowAscending(String column) {
        return sortRowAscending(column, false);
    }

    /**
     * Stable sort by one column, {@code null} last.
     *
     * @param integerOrder compare by each value's leading integer
     * @throws io.hisondata.core.SortTypeException if {@code integerOrder} meets a non-integer value
     */
    public DataTable sortRowAscending(String column, boolean integerOrder) {
        String name = existingColumn(column);
        Comparator<Object> order = new ValueOrdering(codec, integerOrder).nullsLast();
        rows.sort(Comparator.<LinkedHashMap<String, Object>, Object>comparing(row -> row.get(name), order));
        return this;
    }

    public DataTable sortRowDescending(String column) {
        return sortRowDescending(column, false);
    }

    /**
     * Stable sort by one column in descending order, {@code null} first.
     */
    public DataTable sortRowDescending(String column, boolean integerOrder) {
        String name = existingColumn(column);
        Comparator<Object> order = new ValueOrdering(codec, integerOrder).reversedNullsFirst();
        rows.sort(Comparator.<LinkedHashMap<String, Object>, Object>comparing(row -> row.get(name), order));
        return this;
    }

    public DataTable sortRowReverse() {
        Collections.reverse(rows);
        return this;
    }

    @Override
    public TableSnapshot getObject() {
        List<Map<String, Object>> copies = getRows();
        return new TableSnapshot(getColumns(), copies, columns.size(), copies.size(), isDeclared());
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns + ", rowCount=" + rows.size() + '}';
    }

    // Internals

    private void put(List<?> data) {
        if (data.isEmpty()) {
            return;
        }
        Object first = data.get(0);
        if (first == null || first instanceof Undefined || Scalars.isScalar(first)) {
            for (Object column : data) {
                declareColumn(column);
            }
            return;
        }
        for (Object row : data) {
            insertRow(rows.size(), row);
        }
    }

    private void insertRow(int position, Object row) {
        if (row instanceof DataContainer) {
            throw new NestedContainerException("a " + row.getClass().getSimpleName() + " cannot be added as a row");
        }
        if (!(row instanceof Map<?, ?> source)) {
            throw new InvalidArgumentTypeException("a row must be a map of column names to values, got: "
                    + (row == null ? "null" : row.getClass().getName()));
        }
        if (source.isEmpty()) {
            return;
        }
        if (columns.isEmpty()) {
            for (Object key : source.keySet()) {
                declareColumn(key);
            }
        }
        LinkedHashMap<String, Object> built = new LinkedHashMap<>();
        for (String column : columns) {
            built.put(column, source.containsKey(column) ? validValue(position, column, source.get(column)) : null);
        }
        rows.add(position, built);
        for (Map.Entry<String, Object> entry : built.entrySet()) {
            kinds.stored(entry.getKey(), entry.getValue());
        }
    }

    private Object validValue(int rowIndex, String column, Object value) {
        rejectUndefined(value);
        if (value instanceof DataContainer) {
            throw new NestedContainerException("a " + value.getClass().getSimpleName()
                    + " cannot be stored in a table. column: " + column);
        }
        Object copy = copier.copy(value);
        kinds.check(rows, rowIndex, column, copy);
        return copy;
    }

    private String declareColumn(Object column) {
        String name = validColumnName(column);
        if (columns.contains(name)) {
            throw new DuplicateColumnException("duplicate column: " + name);
        }
        columns.add(name);
        return name;
    }

    private static String validColumnName(Object column) {
        if (column instanceof Undefined) {
            throw new UndefinedValueException("a column name cannot be undefined");
        }
        if (column == null) {
            throw new InvalidArgumentTypeException("a column name cannot be null");
        }
        if (column instanceof DataContainer) {
            throw new NestedContainerException("a " + column.getClass().getSimpleName() + " cannot be a column name");
        }
        if (!Scalars.isScalar(column)) {
            throw new InvalidArgumentTypeException("a column name must be convertible to a string, got: "
                    + column.getClass().getName());
        }
        String name = Scalars.toText(column);
        if (name.isEmpty()) {
            throw new InvalidArgumentTypeException("a column name cannot be empty");
        }
        return name;
    }

    private String existingColumn(String column) {
        String name = validColumnName(column);
        if (!columns.contains(name)) {
            throw new ColumnNotFoundException("the column does not exist. column: " + name);
        }
        return name;
    }

    private int validRowIndex(int index) {
        if (index < 0 || index >= rows.size()) {
            throw new RowIndexOutOfRangeException(index, rows.size());
        }
        return index;
    }

    private int insertIndex(int index) {
        if (index < 0 || index > rows.size()) {
            throw new RowIndexOutOfRangeException(index, rows.size());
        }
        return index;
    }

    private List<Integer> rangeIndexes(int start, int end) {
        if (rows.isEmpty()) {
            return List.of();
        }
        int from = validRowIndex(start);
        int to = validRowIndex(end);
        List<Integer> indexes = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            indexes.add(i);
        }
        return indexes;
    }

    private static void rejectUndefined(Object value) {
        if (value instanceof Undefined) {
            throw new UndefinedValueException("an undefined value cannot be stored; use null instead");
        }
    }

    private static void requireFunction(Object function) {
        if (function == null) {
            throw new InvalidFunctionException("a validator, formatter or filter function is required");
        }
    }

    private LinkedHashMap<String, Object> ordered(Map<String, Object> row) {
        LinkedHashMap<String, Object> result = new LinkedHashMap<>();
        for (String column : columns) {
            result.put(column, row.get(column));
        }
        return result;
    }

    private Map<String, Object> copyRow(int index) {
        return copier.copyRecord(ordered(rows.get(index)));
    }

    private List<Map<String, Object>> copyRows(List<Integer> indexes) {
        List<Map<String, Object>> result = new ArrayList<>(indexes.size());
        for (int index : indexes) {
            result.add(copyRow(index));
        }
        return result;
    }

    private Optional<Map<String, Object>> rowAt(int index) {
        return index < 0 ? Optional.empty() : Optional.of(copyRow(index));
    }

    private int firstNullRowIndex(String column) {
        String name = existingColumn(column);
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).get(name) == null) {
                return i;
            }
        }
        return -1;
    }

    private int firstDuplicateRowIndex(String column) {
        String name = existingColumn(column);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            Object value = rows.get(i).get(name);
            if (value == null) {
                continue;
            }
            if (!seen.add(codec.canonical(value))) {
                return i;
            }
        }
        return -1;
    }

    private int firstInvalidRowIndex(String column, Predicate<Object> validator) {
        requireFunction(validator);
        String name = existingColumn(column);
        for (int i = 0; i < rows.size(); i++) {
            if (!validator.test(copier.copy(rows.get(i).get(name)))) {
                return i;
            }
        }
        return -1;
    }

    private Map<String, String> encodeCondition(Map<String, ?> condition) {
        if (condition == null) {
            throw new InvalidArgumentTypeException("a search condition is required");
        }
        Map<String, String> expected = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : condition.entrySet()) {
            String name = existingColumn(entry.getKey());
            rejectUndefined(entry.getValue());
            expected.put(name, codec.canonical(copier.copy(entry.getValue())));
        }
        return expected;
    }

    private boolean matches(Map<String, Object> row, Map<String, String> expected) {
        for (Map.Entry<String, String> entry : expected.entrySet()) {
            if (!entry.getValue().equals(codec.canonical(row.get(entry.getKey())))) {
                return false;
            }
        }
        return true;
    }

    private void retain(List<Integer> kept) {
        int before = rows.size();
        List<LinkedHashMap<String, Object>> retained = new ArrayList<>(kept.size());
        for (int index : kept) {
            retained.add(rows.get(index));
        }
        rows.clear();
        rows.addAll(retained);
        LOG.debug("Kept {} of {} rows", retained.size(), before);
    }

    private DataTable derive(List<Integer> indexes) {
        DataTable derived = new DataTable(configuration);
        derived.copyFrom(this, indexes);
        return derived;
    }

    private void copyFrom(DataTable source, List<Integer> indexes) {
        columns.addAll(source.columns);
        for (int index : indexes) {
            rows.add(copier.copyRecord(source.ordered(source.rows.get(index))));
        }
        kinds.restoreFrom(source.kinds);
    }

    private static DataTable requireSource(DataTable source) {
        if (source == null) {
            throw new InvalidArgumentTypeException("a source table is required");
        }
        return source;
    }

    private static List<Integer> allRowIndexes(DataTable table) {
        List<Integer> indexes = new ArrayList<>(table.rows.size());
        for (int i = 0; i < table.rows.size(); i++) {
            indexes.add(i);
        }
        return indexes;
    }
}
