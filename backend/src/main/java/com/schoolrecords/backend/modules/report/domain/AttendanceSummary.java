package com.schoolrecords.backend.modules.report.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AttendanceSummary(
        String studentCode,
        String courseCode,
        LocalDate from,
        LocalDate to,
        long totalClasses,
        long presentCount,
        long absentCount,
        long lateCount,
        long excusedCount,
        BigDecimal percentage
) {
}
