package io.hisondata.storage;

import io.hisondata.core.ColumnNotFoundException;
import io.hisondata.core.InvalidArgumentTypeException;
import io.hisondata.core.InvalidFunctionException;
import io.hisondata.core.UndefinedValueException;
import io.hisondata.kernel.Undefined;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataTableQueryTest {

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private static DataTable orders() {
        return new DataTable(List.of(
                row("id", 1, "status", "open", "meta", Map.of("priority", 1)),
                row("id", 2, "status", "closed", "meta", Map.of("priority", 2)),
                row("id", 3, "status", "open", "meta", Map.of("priority", 1.0)),
                row("id", 4, "status", null, "meta", null)));
    }

    @Test
    @DisplayName("Should find rows whose values equal every condition entry")
    void shouldSearchByCondition() {
        DataTable table = orders();

        assertThat(table.searchRowIndexes(Map.of("status", "open"))).containsExactly(0, 2);
        assertThat(table.searchRows(Map.of("status", "open", "id", 3)))
                .extracting(r -> r.get("id")).containsExactly(3);
    }

    @Test
    @DisplayName("Should compare structured values by canonical encoding")
    void shouldMatchStructuredValuesCanonically() {
        assertThat(orders().searchRowIndexes(Map.of("meta", Map.of("priority", 1)))).containsExactly(0, 2);
    }

    @Test
    @DisplayName("Should partition rows between a condition and its negation")
    void shouldPartitionWithNegation() {
        DataTable table = orders();
        Map<String, Object> condition = Map.of("status", "open");

        List<Integer> matched = table.searchRowIndexes(condition);
        List<Integer> rest = table.searchRowIndexes(condition, true);

        List<Integer> all = new ArrayList<>(matched);
        all.addAll(rest);
        assertThat(all).containsExactlyInAnyOrder(0, 1, 2, 3);
        assertThat(matched).doesNotContainAnyElementsOf(rest);
    }

    @Test
    @DisplayName("Should match null condition values against null cells")
    void shouldMatchNull() {
        Map<String, Object> condition = new LinkedHashMap<>();
        condition.put("status", null);

        assertThat(orders().searchRowIndexes(condition)).containsExactly(3);
    }

    @Test
    @DisplayName("Should reject unknown columns and undefined values in a condition")
    void shouldValidateCondition() {
        DataTable table = orders();

        assertThatThrownBy(() -> table.searchRows(Map.of("missing", 1)))
                .isInstanceOf(ColumnNotFoundException.class);
        assertThatThrownBy(() -> table.searchRows(Map.of("id", Undefined.VALUE)))
                .isInstanceOf(UndefinedValueException.class);
        assertThatThrownBy(() -> table.searchRows(null))
                .isInstanceOf(InvalidArgumentTypeException.class);
    }

    @Test
    @DisplayName("Should keep only matching rows, or discard them when negated")
    void shouldSearchAndModify() {
        DataTable kept = orders().searchAndModify(Map.of("status", "open"));
        DataTable dropped = orders().searchAndModify(Map.of("status", "open"), true);

        assertThat(kept.getColumnValues("id")).containsExactly(1, 3);
        assertThat(dropped.getColumnValues("id")).containsExactly(2, 4);
    }

    @Test
    @DisplayName("Should return matches as a new table with the same columns")
    void shouldSearchRowsAsTable() {
        DataTable source = orders();
        DataTable matches = source.searchRowsAsTable(Map.of("status", "nobody"));

        assertThat(matches.getColumns()).isEqualTo(source.getColumns());
        assertThat(matches.getRowCount()).isZero();
        assertThat(source.getRowCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should filter rows with a predicate that sees copies")
    void shouldFilterRows() {
        DataTable table = orders();

        List<Integer> indexes = table.filterRowIndexes(r -> {
            r.put("status", "tampered");
            return ((Integer) r.get("id")) % 2 == 0;
        });

        assertThat(indexes).containsExactly(1, 3);
        assertThat(table.getColumnValues("status")).doesNotContain("tampered");
        assertThat(table.filterRows(r -> r.get("meta") == null)).hasSize(1);
        assertThat(table.filterRowsAsTable(r -> true).getRowCount()).isEqualTo(4);
        assertThat(table.filterAndModify(r -> "open".equals(r.get("status"))).getRowCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject a missing filter function")
    void shouldRejectMissingFunction() {
        assertThatThrownBy(() -> orders().filterRows(null))
                .isInstanceOf(InvalidFunctionException.class)
                .isInstanceOf(InvalidArgumentTypeException.class);
        assertThatThrownBy(() -> orders().isValidValue("id", null))
                .isInstanceOf(InvalidFunctionException.class);
    }

    @Test
    @DisplayName("Should report the first null cell of a column")
    void shouldFindFirstNull() {
        DataTable table = orders();

        assertThat(table.isNotNullColumn("id")).isTrue();
        assertThat(table.isNotNullColumn("status")).isFalse();
        assertThat(table.findFirstRowNullColumn("status")).get()
                .extracting(r -> r.get("id")).isEqualTo(4);
        assertThat(table.findFirstRowNullColumn("id")).isEmpty();
    }

    @Test
    @DisplayName("Should report the first repeated value of a column")
    void shouldFindFirstDuplicate() {
        DataTable table = new DataTable(List.of(
                row("code", "A"), row("code", null), row("code", "A"), row("code", null), row("code", "A")));

        assertThat(table.isNotDuplColumn("code")).isFalse();
        assertThat(table.findFirstRowDuplColumn("code")).contains(row("code", "A"));
        assertThat(table.searchRowIndexes(Map.of("code", "A"))).containsExactly(0, 2, 4);
        assertThat(orders().isNotDuplColumn("id")).isTrue();
    }

    @Test
    @DisplayName("Should report the third row as the first repeat of x")
    void shouldReportDuplicateAtSecondOccurrence() {
        DataTable table = new DataTable(List.of(row("x", 1), row("x", 2), row("x", 1)));

        assertThat(table.findFirstRowDuplColumn("x")).contains(row("x", 1));
        assertThat(table.searchRowIndexes(Map.of("x", 1))).containsExactly(0, 2);
    }

    @Test
    @DisplayName("Should treat integral doubles as duplicates of integers")
    void shouldDetectNumericDuplicatesCanonically() {
        DataTable table = new DataTable(List.of(row("n", 1), row("n", 1.0)));

        assertThat(table.isNotDuplColumn("n")).isFalse();
    }

    @Test
    @DisplayName("Should report the first value rejected by a validator")
    void shouldFindFirstInvalidValue() {
        DataTable table = orders();

        assertThat(table.isValidValue("id", v -> ((Integer) v) > 0)).isTrue();
        assertThat(table.findFirstRowInvalidValue("id", v -> ((Integer) v) < 3)).get()
                .extracting(r -> r.get("id")).isEqualTo(3);
        assertThat(table.isValidValue("status", v -> v != null)).isFalse();
    }

    @Test
    @DisplayName("Should return copies of column values")
    void shouldReturnColumnValues() {
        assertThat(orders().getColumnValues("status")).isEqualTo(Arrays.asList("open", "closed", "open", null));
    }
}
