package com.phillippitts.mathwords.presentation.dto;

import java.util.List;

public record BatchResponse(List<String> results) {
}
