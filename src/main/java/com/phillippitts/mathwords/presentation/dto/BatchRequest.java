package com.phillippitts.mathwords.presentation.dto;

import com.phillippitts.mathwords.service.BatchItem;

import java.util.List;

/**
 * Body of {@code POST /api/v1/verbalize/batch}. All items share one speech style.
 */
public record BatchRequest(List<BatchItem> items, String speechStyle) {
}
