package com.schoolrecords.backend.modules.enrollment.presentation.dto;

import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;

public final class EnrollmentDtoMapper {

    private EnrollmentDtoMapper() {
    }

    public static EnrollmentResponse toResponse(Enrollment enrollment) {
        Course course = enrollment.getCourse();
        return new EnrollmentResponse(
                enrollment.getId(),
                enrollment.getStudent().getStudentCode(),
                course.getCode(),
                course.getName(),
                course.getCreditHours(),
                enrollment.getSemester(),
                enrollment.getAcademicYear(),
                enrollment.getCreatedAt()
        );
    }
}
