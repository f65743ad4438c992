package com.schoolrecords.backend.modules.student.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StudentResponse(
        String studentCode,
        String firstName,
        String lastName,
        LocalDate dateOfBirth,
        String gender,
        String email,
        String phone,
        String address,
        String photoReference,
        LocalDate enrollmentDate,
        OffsetDateTime createdAt
) {
}
