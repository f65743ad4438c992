package com.schoolrecords.backend.modules.grade.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public record GradeResponse(
        UUID enrollmentId,
        String studentCode,
        String courseCode,
        BigDecimal marks,
        String letterGrade,
        int gradePoints,
        String remark,
        OffsetDateTime updatedAt
) {
}
