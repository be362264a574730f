package io.hisondata.storage;

import io.hisondata.core.TypeCheckMode;
import io.hisondata.core.TypeConsistencyException;
import io.hisondata.kernel.ValueKind;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Enforces per-column kind consistency for one table.
 */
final class ColumnKindTracker {
    private final TypeCheckMode mode;
    private final Map<String, ValueKind> declared = new HashMap<>();

    ColumnKindTracker(TypeCheckMode mode) {
        this.mode = mode;
    }

    TypeCheckMode mode() {
        return mode;
    }

    /**
     * Kind a value written at {@code rowIndex} must have, or {@code null} if any kind is accepted.
     */
    ValueKind expected(List<? extends Map<String, Object>> rows, int rowIndex, String column) {
        if (mode == TypeCheckMode.DECLARED_KIND) {
            return declared.get(column);
        }
        for (int i = Math.min(rowIndex, rows.size()) - 1; i >= 0; i--) {
            Object prior = rows.get(i).get(column);
            if (prior != null) {
                return ValueKind.of(prior);
            }
        }
        return null;
    }

    void check(List<? extends Map<String, Object>> rows, int rowIndex, String column, Object value) {
        if (value == null) {
            return;
        }
        ValueKind expected = expected(rows, rowIndex, column);
        if (expected == null) {
            return;
        }
        ValueKind actual = ValueKind.of(value);
        if (!expected.equals(actual)) {
            throw new TypeConsistencyException("values of one column must share a kind. column: " + column
                    + ", expected: " + expected + ", actual: " + actual + ", row: " + rowIndex);
        }
    }

    void stored(String column, Object value) {
        if (mode == TypeCheckMode.DECLARED_KIND && value != null) {
            declared.putIfAbsent(column, ValueKind.of(value));
        }
    }

    void release(String column) {
        declared.remove(column);
    }

    void clear() {
        declared.clear();
    }

    void restoreFrom(ColumnKindTracker other) {
        declared.clear();
        if (mode == other.mode) {
            declared.putAll(other.declared);
        }
    }
}
