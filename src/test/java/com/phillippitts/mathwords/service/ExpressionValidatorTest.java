package com.phillippitts.mathwords.service;

import com.phillippitts.mathwords.config.properties.MathWordsProperties;
import com.phillippitts.mathwords.exception.EmptyInputException;
import com.phillippitts.mathwords.exception.ExpressionTooLongException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionValidatorTest {

    private ExpressionValidator validator;

    @BeforeEach
    void setup() {
        validator = new ExpressionValidator(new MathWordsProperties(null, 16, null));
    }

    @Test
    void shouldRejectNullEmptyAndBlank() {
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> validator.validate("")).isInstanceOf(EmptyInputException.class);
        assertThatThrownBy(() -> validator.validate(" \t\n")).isInstanceOf(EmptyInputException.class);
    }

    @Test
    void shouldAcceptInputAtTheLimit() {
        assertThatCode(() -> validator.validate("x".repeat(16))).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectInputOverTheLimit() {
        assertThatThrownBy(() -> validator.validate("x".repeat(17)))
                .isInstanceOf(ExpressionTooLongException.class)
                .hasMessageContaining("17")
                .satisfies(e -> assertThat(((ExpressionTooLongException) e).getLimit()).isEqualTo(16));
    }

    @Test
    void defaultsShouldAllowLongExpressions() {
        ExpressionValidator lenient = new ExpressionValidator(new MathWordsProperties());

        assertThatCode(() -> lenient.validate("x+".repeat(5_000) + "x")).doesNotThrowAnyException();
    }
}
