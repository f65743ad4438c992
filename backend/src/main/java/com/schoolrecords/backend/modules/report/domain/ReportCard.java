package com.schoolrecords.backend.modules.report.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Term transcript of one student. Only graded enrollments appear as entries,
 * and {@code totalCredits} and {@code gpa} are computed over those entries.
 */
public record ReportCard(
        String studentCode,
        String studentName,
        String semester,
        String academicYear,
        List<ReportCardEntry> entries,
        int totalCredits,
        BigDecimal gpa
) {

    public static ReportCard of(
            String studentCode,
            String studentName,
            String semester,
            String academicYear,
            List<ReportCardEntry> entries
    ) {
        return new ReportCard(
                studentCode,
                studentName,
                semester,
                academicYear,
                List.copyOf(entries),
                ReportCalculations.totalCredits(entries),
                ReportCalculations.gpa(entries)
        );
    }

    public static ReportCard empty(String studentCode, String semester, String academicYear) {
        return of(studentCode, null, semester, academicYear, List.of());
    }
}
