package com.phillippitts.mathwords.service.verbalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpokenNumbersTest {

    @Test
    void shouldSpellSmallCardinals() {
        assertThat(SpokenNumbers.cardinal(2)).isEqualTo("two");
        assertThat(SpokenNumbers.cardinal(20)).isEqualTo("twenty");
        assertThat(SpokenNumbers.cardinal(21)).isEqualTo("21");
    }

    @Test
    void shouldFallBackToNumericOrdinals() {
        assertThat(SpokenNumbers.ordinalWord(4)).isEqualTo("fourth");
        assertThat(SpokenNumbers.ordinalWord(22)).isEqualTo("22nd");
    }

    @Test
    void numericOrdinalsShouldHandleTeens() {
        assertThat(SpokenNumbers.numericOrdinal(1)).isEqualTo("1st");
        assertThat(SpokenNumbers.numericOrdinal(3)).isEqualTo("3rd");
        assertThat(SpokenNumbers.numericOrdinal(11)).isEqualTo("11th");
        assertThat(SpokenNumbers.numericOrdinal(12)).isEqualTo("12th");
        assertThat(SpokenNumbers.numericOrdinal(113)).isEqualTo("113th");
        assertThat(SpokenNumbers.numericOrdinal(21)).isEqualTo("21st");
    }

    @Test
    void shouldPluralizeFractionDenominators() {
        assertThat(SpokenNumbers.fractionDenominator(2, false)).isEqualTo("half");
        assertThat(SpokenNumbers.fractionDenominator(2, true)).isEqualTo("halves");
        assertThat(SpokenNumbers.fractionDenominator(3, true)).isEqualTo("thirds");
    }

    @Test
    void smallIntegerShouldRejectNonIntegers() {
        assertThat(SpokenNumbers.smallInteger("42")).isEqualTo(42);
        assertThat(SpokenNumbers.smallInteger("3.5")).isEqualTo(-1);
        assertThat(SpokenNumbers.smallInteger("12345678")).isEqualTo(-1);
        assertThat(SpokenNumbers.smallInteger("")).isEqualTo(-1);
    }
}
