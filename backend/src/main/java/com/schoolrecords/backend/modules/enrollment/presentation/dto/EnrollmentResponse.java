package com.schoolrecords.backend.modules.enrollment.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record EnrollmentResponse(
        UUID enrollmentId,
        String studentCode,
        String courseCode,
        String courseName,
        int creditHours,
        String semester,
        String academicYear,
        OffsetDateTime createdAt
) {
}
