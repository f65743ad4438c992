package com.schoolrecords.backend.modules.course.presentation.dto;

import com.schoolrecords.backend.modules.course.domain.Course;

public final class CourseDtoMapper {

    private CourseDtoMapper() {
    }

    public static CourseResponse toResponse(Course course) {
        return new CourseResponse(
                course.getCode(),
                course.getName(),
                course.getCreditHours(),
                course.getDepartment(),
                course.getCreatedAt()
        );
    }
}
