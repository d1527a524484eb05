package com.phillippitts.mathwords.presentation.dto;

import com.phillippitts.mathwords.service.InputFormat;

/**
 * Body of {@code POST /api/v1/verbalize}. Only {@code expression} is required.
 */
public record VerbalizeRequest(String expression, Boolean displayMode, String speechStyle, InputFormat format) {

    public boolean isDisplayMode() {
        return Boolean.TRUE.equals(displayMode);
    }
}
