package com.schoolrecords.backend.modules.grade.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.Size;

/**
 * Marks are range-checked by the grade service so that out-of-range values
 * surface as {@code INVALID_SCORE} rather than a generic validation error.
 */
public record RecordGradeRequest(
        BigDecimal marks,
        @Size(max = 500) String remark
) {
}
