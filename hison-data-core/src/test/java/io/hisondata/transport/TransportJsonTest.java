package io.hisondata.transport;

import io.hisondata.core.InvalidArgumentTypeException;
import io.hisondata.core.ValueEncodingException;
import io.hisondata.storage.DataTable;
import io.hisondata.wrapper.DataWrapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransportJsonTest {

    private final TransportJson transport = new TransportJson();

    @Test
    @DisplayName("Should read an array of records into a table")
    void shouldReadTable() {
        DataTable table = transport.readTable("[{\"id\":1,\"name\":\"Alice\"},{\"id\":2,\"name\":\"Bob\"}]");

        assertThat(table.getColumns()).containsExactly("id", "name");
        assertThat(table.getRow(1)).isEqualTo(Map.of("id", 2, "name", "Bob"));
    }

    @Test
    @DisplayName("Should read a single record into a one-row table")
    void shouldReadSingleRecord() {
        assertThat(transport.readTable("{\"id\":1}").getRowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should read integers beyond long range as numbers in either row order")
    void shouldReadLargeIntegersAsNumbers() {
        String ascending = "[{\"id\":1},{\"id\":12345678901234567890}]";
        String descending = "[{\"id\":12345678901234567890},{\"id\":1}]";

        DataTable first = transport.readTable(ascending);
        DataTable second = transport.readTable(descending);

        assertThat(first.getValue(1, "id")).isEqualTo(new BigDecimal("12345678901234567890"));
        assertThat(second.getValue(1, "id")).isEqualTo(1);
        assertThat(transport.write(first)).isEqualTo(ascending);
    }

    @Test
    @DisplayName("Should store large wrapper integers as their plain digits")
    void shouldReadLargeWrapperIntegers() {
        DataWrapper wrapper = transport.readWrapper("{\"big\":12345678901234567890,\"rows\":[{\"n\":2},{\"n\":98765432109876543210}]}");

        assertThat(wrapper.getString("big")).isEqualTo("12345678901234567890");
        assertThat(wrapper.getTable("rows").getRowCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject scalar and malformed table documents")
    void shouldRejectInvalidTableDocuments() {
        assertThatThrownBy(() -> transport.readTable("42"))
                .isInstanceOf(InvalidArgumentTypeException.class);
        assertThatThrownBy(() -> transport.readTable("[{"))
                .isInstanceOf(ValueEncodingException.class);
    }

    @Test
    @DisplayName("Should read a wrapper, turning objects and arrays into tables")
    void shouldReadWrapper() {
        DataWrapper wrapper = transport.readWrapper(
                "{\"DATAWRAPPER\":\"TRUE\",\"status\":\"ok\",\"count\":2,\"empty\":null,"
                        + "\"users\":[{\"id\":1},{\"id\":2}],\"owner\":{\"id\":7}}");

        assertThat(wrapper.keys()).containsExactly("status", "count", "empty", "users", "owner");
        assertThat(wrapper.getString("count")).isEqualTo("2");
        assertThat(wrapper.getString("empty")).isNull();
        assertThat(wrapper.getTable("users").getColumnValues("id")).containsExactly(1, 2);
        assertThat(wrapper.getTable("owner").getRow(0)).isEqualTo(Map.of("id", 7));
    }

    @Test
    @DisplayName("Should reject a wrapper document that is not an object")
    void shouldRejectNonObjectWrapper() {
        assertThatThrownBy(() -> transport.readWrapper("[1,2]"))
                .isInstanceOf(InvalidArgumentTypeException.class);
    }

    @Test
    @DisplayName("Should write what it reads")
    void shouldRoundTripWrapper() {
        DataWrapper original = new DataWrapper("status", "ok")
                .putTable("users", new DataTable(List.of(Map.of("id", 1), Map.of("id", 2))));

        String json = transport.write(original);

        assertThat(transport.write(transport.readWrapper(json))).isEqualTo(json);
        assertThat(transport.write(original.getTable("users"))).isEqualTo("[{\"id\":1},{\"id\":2}]");
    }
}
