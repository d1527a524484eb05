package com.phillippitts.mathwords.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("x + y", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("x + y", -1)).isEmpty();
    }

    @Test
    void shouldReturnFullStringWhenNotLongerThanMax() {
        assertThat(LogSanitizer.truncate("x^2", 10)).isEqualTo("x^2");
        assertThat(LogSanitizer.truncate("12345", 5)).isEqualTo("12345");
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("\\frac{a}{b}", 5)).isEqualTo("\\frac");
    }

    @Test
    void previewShouldFlattenLineBreaks() {
        assertThat(LogSanitizer.preview("a = 1 \\\\\n\tb = 2")).isEqualTo("a = 1 \\\\ b = 2");
    }

    @Test
    void previewShouldMarkCutExpressions() {
        String longExpression = "x".repeat(200);

        String preview = LogSanitizer.preview(longExpression);

        assertThat(preview).hasSize(LogSanitizer.EXPRESSION_PREVIEW + 3).endsWith("...");
        assertThat(LogSanitizer.preview("x".repeat(LogSanitizer.EXPRESSION_PREVIEW)))
                .doesNotEndWith("...");
    }
}
