package com.schoolrecords.backend.modules.enrollment.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record EnrollRequest(
        @NotBlank @Size(max = 32) String studentCode,
        @NotBlank @Size(max = 32) String courseCode,
        @NotBlank @Size(max = 32) String semester,
        @NotBlank @Size(max = 16) String academicYear
) {
}
