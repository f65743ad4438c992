package com.schoolrecords.backend.modules.grade.domain;

import java.math.BigDecimal;

/**
 * Letter bands with inclusive lower bounds. Total over [0, 100].
 */
public enum LetterGrade {
    A(90, 4),
    B(80, 3),
    C(70, 2),
    D(60, 1),
    F(0, 0);

    private static final BigDecimal MAX_MARKS = BigDecimal.valueOf(100);

    private final BigDecimal lowerBound;
    private final int gradePoints;

    LetterGrade(int lowerBound, int gradePoints) {
        this.lowerBound = BigDecimal.valueOf(lowerBound);
        this.gradePoints = gradePoints;
    }

    public int getGradePoints() {
        return gradePoints;
    }

    public static LetterGrade fromMarks(BigDecimal marks) {
        if (marks == null || marks.signum() < 0 || marks.compareTo(MAX_MARKS) > 0) {
            throw new IllegalArgumentException("marks must be within [0, 100]: " + marks);
        }
        for (LetterGrade letter : values()) {
            if (marks.compareTo(letter.lowerBound) >= 0) {
                return letter;
            }
        }
        return F;
    }
}
