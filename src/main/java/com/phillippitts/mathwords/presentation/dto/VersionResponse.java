package com.phillippitts.mathwords.presentation.dto;

public record VersionResponse(String version) {
}
