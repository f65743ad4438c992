package com.schoolrecords.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;

public record AttendanceRecordResponse(
        LocalDate date,
        String status,
        String remark
) {
}
