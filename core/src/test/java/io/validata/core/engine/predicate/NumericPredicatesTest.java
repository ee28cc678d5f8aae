package io.validata.core.engine.predicate;

import static org.assertj.core.api.Assertions.assertThat;

import io.validata.core.model.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NumericPredicatesTest")
class NumericPredicatesTest {

    @Test
    void everyIntegerRenderingIsAnInt() {
        assertThat(NumericPredicates.isNotInt(Value.signed(-42))).isFalse();
        assertThat(NumericPredicates.isNotInt(Value.signed(Long.MIN_VALUE))).isFalse();
        assertThat(NumericPredicates.isNotInt(Value.unsigned(-1L))).isFalse();
    }

    @Test
    @DisplayName("uint requires at least two digits, so single digits are rejected")
    void uintSingleDigitQuirk() {
        assertThat(NumericPredicates.isNotUint(Value.unsigned(10))).isFalse();
        assertThat(NumericPredicates.isNotUint(Value.unsigned(-1L))).isFalse();
        assertThat(NumericPredicates.isNotUint(Value.unsigned(7))).isTrue();
        assertThat(NumericPredicates.isNotUint(Value.signed(-15))).isTrue();
    }

    @Test
    @DisplayName("float rejects NaN and infinities")
    void floatRendering() {
        assertThat(NumericPredicates.isNotFloat(Value.floating(3.14159))).isFalse();
        assertThat(NumericPredicates.isNotFloat(Value.floating(-0.5))).isFalse();
        assertThat(NumericPredicates.isNotFloat(Value.floating(1e300))).isFalse();
        assertThat(NumericPredicates.isNotFloat(Value.floating(Double.NaN))).isTrue();
        assertThat(NumericPredicates.isNotFloat(Value.floating(Double.POSITIVE_INFINITY))).isTrue();
    }
}
