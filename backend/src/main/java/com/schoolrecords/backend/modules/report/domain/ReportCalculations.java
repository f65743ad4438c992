package com.schoolrecords.backend.modules.report.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Decimal arithmetic for report figures. Results carry two decimals, rounded
 * half up, and an empty input yields {@code 0.00}.
 */
public final class ReportCalculations {

    private static final int SCALE = 2;
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private ReportCalculations() {
    }

    public static int totalCredits(List<ReportCardEntry> entries) {
        return entries.stream().mapToInt(ReportCardEntry::creditHours).sum();
    }

    /** Credit-weighted mean of grade points. */
    public static BigDecimal gpa(List<ReportCardEntry> entries) {
        int credits = totalCredits(entries);
        if (credits == 0) {
            return ZERO;
        }
        BigDecimal weighted = BigDecimal.ZERO;
        for (ReportCardEntry entry : entries) {
            weighted = weighted.add(BigDecimal.valueOf((long) entry.letterGrade().getGradePoints() * entry.creditHours()));
        }
        return weighted.divide(BigDecimal.valueOf(credits), SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal percentage(long part, long total) {
        if (total == 0) {
            return ZERO;
        }
        return BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), SCALE, RoundingMode.HALF_UP);
    }
}
