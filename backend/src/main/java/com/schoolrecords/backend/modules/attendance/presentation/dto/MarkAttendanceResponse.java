package com.schoolrecords.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.List;

public record MarkAttendanceResponse(
        String courseCode,
        LocalDate date,
        int inserted,
        int updated,
        List<MarkedEntryResponse> entries
) {

    public record MarkedEntryResponse(
            String studentCode,
            String status,
            String outcome
    ) {
    }
}
