package com.schoolrecords.backend.modules.course.presentation.dto;

import java.time.OffsetDateTime;

public record CourseResponse(
        String code,
        String name,
        int creditHours,
        String department,
        OffsetDateTime createdAt
) {
}
