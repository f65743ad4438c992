package com.schoolrecords.backend.modules.student.presentation.dto;

import com.schoolrecords.backend.modules.student.domain.Student;

public final class StudentDtoMapper {

    private StudentDtoMapper() {
    }

    public static StudentResponse toResponse(Student student) {
        return new StudentResponse(
                student.getStudentCode(),
                student.getFirstName(),
                student.getLastName(),
                student.getDateOfBirth(),
                student.getGender().name(),
                student.getEmail(),
                student.getPhone(),
                student.getAddress(),
                student.getPhotoReference(),
                student.getEnrollmentDate(),
                student.getCreatedAt()
        );
    }
}
