package com.phillippitts.mathwords.presentation.dto;

public record VerbalizeResponse(String text, String speechStyle, boolean displayMode) {
}
