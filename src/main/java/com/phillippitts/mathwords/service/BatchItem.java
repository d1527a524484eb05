package com.phillippitts.mathwords.service;

import java.util.Objects;

/**
 * One entry of a batch conversion.
 *
 * @param expression source text; validated like a single {@code verbalize} call
 * @param displayMode display flag, null meaning inline
 * @param format input format, null meaning LaTeX
 */
public record BatchItem(String expression, Boolean displayMode, InputFormat format) {

    public static BatchItem of(String expression) {
        return new BatchItem(expression, null, null);
    }

    public static BatchItem of(String expression, boolean displayMode) {
        return new BatchItem(expression, displayMode, null);
    }

    public boolean isDisplayMode() {
        return Boolean.TRUE.equals(displayMode);
    }

    public InputFormat formatOrDefault() {
        return Objects.requireNonNullElse(format, InputFormat.LATEX);
    }
}
