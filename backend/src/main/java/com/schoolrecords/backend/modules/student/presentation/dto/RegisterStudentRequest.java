package com.schoolrecords.backend.modules.student.presentation.dto;

import java.time.LocalDate;

import com.schoolrecords.backend.modules.student.domain.Gender;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

public record RegisterStudentRequest(
        @NotBlank @Size(max = 100) String firstName,
        @NotBlank @Size(max = 100) String lastName,
        @NotNull @Past LocalDate dateOfBirth,
        @NotNull Gender gender,
        @Email @Size(max = 254) String email,
        @Size(max = 32) String phone,
        @Size(max = 500) String address,
        @Size(max = 500) String photoReference,
        LocalDate enrollmentDate
) {
}
