package com.schoolrecords.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.List;

import com.schoolrecords.backend.modules.attendance.domain.AttendanceStatus;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record MarkAttendanceRequest(
        @NotNull LocalDate date,
        @NotEmpty List<@Valid Entry> entries
) {

    public record Entry(
            @NotBlank String studentCode,
            @NotNull AttendanceStatus status,
            @Size(max = 500) String remark
    ) {
    }
}
