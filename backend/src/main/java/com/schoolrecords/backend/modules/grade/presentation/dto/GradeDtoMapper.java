package com.schoolrecords.backend.modules.grade.presentation.dto;

import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;
import com.schoolrecords.backend.modules.grade.domain.Grade;

public final class GradeDtoMapper {

    private GradeDtoMapper() {
    }

    public static GradeResponse toResponse(Grade grade) {
        Enrollment enrollment = grade.getEnrollment();
        return new GradeResponse(
                enrollment.getId(),
                enrollment.getStudent().getStudentCode(),
                enrollment.getCourse().getCode(),
                grade.getMarks(),
                grade.getLetterGrade().name(),
                grade.getLetterGrade().getGradePoints(),
                grade.getRemark(),
                grade.getUpdatedAt()
        );
    }
}
