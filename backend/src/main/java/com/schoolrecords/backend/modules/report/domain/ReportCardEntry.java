package com.schoolrecords.backend.modules.report.domain;

import java.math.BigDecimal;

import com.schoolrecords.backend.modules.grade.domain.LetterGrade;

public record ReportCardEntry(
        String courseCode,
        String courseName,
        int creditHours,
        BigDecimal marks,
        LetterGrade letterGrade,
        String remark
) {
}
