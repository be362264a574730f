package io.hisondata.storage;

import io.hisondata.core.HisonData;
import io.hisondata.core.HisonDataConfiguration;
import io.hisondata.core.TypeCheckMode;
import io.hisondata.core.TypeConsistencyException;
import io.hisondata.core.converter.ValueConverterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataTableTypeConsistencyTest {

    private static final HisonDataConfiguration DECLARED = HisonDataConfiguration.builder()
            .typeCheckMode(TypeCheckMode.DECLARED_KIND)
            .build();

    @AfterEach
    void restoreDefaults() {
        HisonData.reset();
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    @DisplayName("Should reject a number written below a string value")
    void shouldRejectKindMismatch() {
        DataTable table = new DataTable(row("name", "Alice")).addRow();

        assertThatThrownBy(() -> table.setValue(1, "name", 42))
                .isInstanceOf(TypeConsistencyException.class)
                .hasMessageContaining("name")
                .hasMessageContaining("string")
                .hasMessageContaining("number");
    }

    @Test
    @DisplayName("Should always accept null")
    void shouldAcceptNull() {
        DataTable table = new DataTable(row("name", "Alice"));

        table.addRow(row("name", null)).setValue(0, "name", null);

        assertThat(table.getColumnValues("name")).containsExactly(null, null);
    }

    @Test
    @DisplayName("Should treat integers and decimals as one kind")
    void shouldGroupNumbers() {
        DataTable table = new DataTable(List.of(Map.of("n", 1), Map.of("n", 2.5)));

        assertThat(table.getColumnValues("n")).containsExactly(1, 2.5);
    }

    @Test
    @DisplayName("Should reject a row whose value conflicts with rows above it")
    void shouldRejectConflictingRow() {
        DataTable table = new DataTable(row("n", 1));

        assertThatThrownBy(() -> table.addRow(row("n", "one")))
                .isInstanceOf(TypeConsistencyException.class);
        assertThat(table.getRowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should only look at rows above the written index when scanning backward")
    void shouldScanBackwardFromIndex() {
        DataTable table = new DataTable(row("v", null));
        table.addRow(row("v", "text"));

        table.setValue(0, "v", 7);

        assertThat(table.getColumnValues("v")).containsExactly(7, "text");
    }

    @Test
    @DisplayName("Should fix the column kind at the first stored value in declared mode")
    void shouldFixKindInDeclaredMode() {
        DataTable table = new DataTable(row("v", null), DECLARED);
        table.addRow(row("v", "text"));

        assertThatThrownBy(() -> table.setValue(0, "v", 7))
                .isInstanceOf(TypeConsistencyException.class);
    }

    @Test
    @DisplayName("Should release the declared kind when the column is rewritten")
    void shouldReleaseKindOnColumnRewrite() {
        DataTable table = new DataTable(row("v", "text"), DECLARED);

        table.setColumnSameValue("v", 1);

        assertThat(table.getValue(0, "v")).isEqualTo(1);
        assertThatThrownBy(() -> table.setValue(0, "v", "again"))
                .isInstanceOf(TypeConsistencyException.class);
    }

    @Test
    @DisplayName("Should keep the declared kind in clones")
    void shouldCarryDeclaredKindIntoClone() {
        DataTable clone = new DataTable(row("v", "text"), DECLARED).clone();
        clone.addRow(0);

        assertThatThrownBy(() -> clone.setValue(0, "v", 1))
                .isInstanceOf(TypeConsistencyException.class);
    }

    @Test
    @DisplayName("Should use the globally installed configuration for new tables")
    void shouldUseGlobalConfiguration() {
        HisonData.configure(HisonDataConfiguration.builder()
                .valueConverter(ValueConverterRegistry.withDefaults())
                .build());

        DataTable table = new DataTable(row("day", LocalDate.of(2024, 5, 1)));

        assertThat(table.getValue(0, "day")).isEqualTo("2024-05-01");
        assertThat(table.getConfiguration()).isSameAs(HisonData.configuration());
    }

    @Test
    @DisplayName("Should compare opaque values by runtime class")
    void shouldCompareOpaqueKindsByClass() {
        DataTable table = new DataTable(row("day", LocalDate.of(2024, 5, 1)));

        assertThatThrownBy(() -> table.addRow(row("day", java.time.LocalTime.NOON)))
                .isInstanceOf(TypeConsistencyException.class)
                .hasMessageContaining("java.time.LocalDate");
    }
}
