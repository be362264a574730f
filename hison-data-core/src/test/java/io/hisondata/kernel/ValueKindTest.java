package io.hisondata.kernel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueKindTest {

    @Test
    @DisplayName("Should group scalars by family")
    void shouldClassifyScalars() {
        assertThat(ValueKind.of(null)).isNull();
        assertThat(ValueKind.of("a")).isEqualTo(ValueKind.STRING);
        assertThat(ValueKind.of('c')).isEqualTo(ValueKind.STRING);
        assertThat(ValueKind.of(1)).isEqualTo(ValueKind.NUMBER);
        assertThat(ValueKind.of(2.5)).isEqualTo(ValueKind.NUMBER);
        assertThat(ValueKind.of(new BigDecimal("1.10"))).isEqualTo(ValueKind.NUMBER);
        assertThat(ValueKind.of(BigInteger.TEN)).isEqualTo(ValueKind.BIG_INTEGER);
        assertThat(ValueKind.of(false)).isEqualTo(ValueKind.BOOLEAN);
    }

    @Test
    @DisplayName("Should classify lists, maps and opaque values")
    void shouldClassifyStructuredValues() {
        assertThat(ValueKind.of(List.of())).isEqualTo(ValueKind.ARRAY);
        assertThat(ValueKind.of(Map.of())).isEqualTo(ValueKind.RECORD);

        ValueKind opaque = ValueKind.of(LocalDate.of(2024, 1, 1));

        assertThat(opaque.category()).isEqualTo(ValueKind.Category.OPAQUE);
        assertThat(opaque.type()).isEqualTo(LocalDate.class);
        assertThat(opaque.isStructured()).isTrue();
        assertThat(opaque.toString()).isEqualTo("java.time.LocalDate");
        assertThat(ValueKind.NUMBER.isStructured()).isFalse();
    }

    @Test
    @DisplayName("Should require a type for opaque kinds only")
    void shouldValidateComponents() {
        assertThatThrownBy(() -> new ValueKind(ValueKind.Category.OPAQUE, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ValueKind(ValueKind.Category.STRING, String.class))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
