package com.schoolrecords.backend.modules.student.domain;

public final class StudentCodeFormatter {

    public static final String PREFIX = "STU";
    public static final int MIN_YEAR = 1000;
    public static final int MAX_YEAR = 9999;

    private StudentCodeFormatter() {
    }

    public static String prefixFor(int year) {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("year must have four digits: " + year);
        }
        return PREFIX + year;
    }

    /**
     * Formats {@code STU<year><seq>} with the sequence zero padded to four digits.
     * Sequences above 9999 widen the code instead of wrapping.
     */
    public static String toStudentCode(int year, int sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive: " + sequence);
        }
        return prefixFor(year) + String.format("%04d", sequence);
    }

    /**
     * Returns the sequence part of a code issued for {@code year}, or -1 when the
     * code belongs to another year or is malformed.
     */
    public static int sequenceOf(String studentCode, int year) {
        String prefix = prefixFor(year);
        if (studentCode == null || !studentCode.startsWith(prefix) || studentCode.length() < prefix.length() + 4) {
            return -1;
        }
        String digits = studentCode.substring(prefix.length());
        for (int i = 0; i < digits.length(); i++) {
            char ch = digits.charAt(i);
            if (ch < '0' || ch > '9') {
                return -1;
            }
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }
}
