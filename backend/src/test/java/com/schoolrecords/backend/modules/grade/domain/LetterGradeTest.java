package com.schoolrecords.backend.modules.grade.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LetterGradeTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "100, A",
            "90, A",
            "89.99, B",
            "80, B",
            "79.99, C",
            "70, C",
            "69.99, D",
            "60, D",
            "59.99, F",
            "0, F"
    })
    @DisplayName("band lower bounds are inclusive")
    void derivesLetterFromMarks(String marks, LetterGrade expected) {
        assertThat(LetterGrade.fromMarks(new BigDecimal(marks))).isEqualTo(expected);
    }

    @Test
    @DisplayName("grade points run from 4 for A down to 0 for F")
    void exposesGradePoints() {
        assertThat(LetterGrade.A.getGradePoints()).isEqualTo(4);
        assertThat(LetterGrade.B.getGradePoints()).isEqualTo(3);
        assertThat(LetterGrade.C.getGradePoints()).isEqualTo(2);
        assertThat(LetterGrade.D.getGradePoints()).isEqualTo(1);
        assertThat(LetterGrade.F.getGradePoints()).isZero();
    }

    @Test
    @DisplayName("marks outside [0, 100] are rejected")
    void rejectsOutOfRangeMarks() {
        assertThatThrownBy(() -> LetterGrade.fromMarks(new BigDecimal("-0.01")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LetterGrade.fromMarks(new BigDecimal("100.01")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
