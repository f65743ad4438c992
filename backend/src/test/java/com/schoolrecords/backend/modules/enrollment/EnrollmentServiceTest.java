package com.schoolrecords.backend.modules.enrollment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.schoolrecords.backend.global.error.ProblemException;
import com.schoolrecords.backend.global.security.AcademicCapability;
import com.schoolrecords.backend.global.security.Capabilities;
import com.schoolrecords.backend.modules.audit.application.AuditLogService;
import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade.CascadeResult;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentService;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentService.EnrollCommand;
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;
import com.schoolrecords.backend.modules.enrollment.infrastructure.persistence.EnrollmentRepository;
import com.schoolrecords.backend.modules.enrollment.presentation.dto.EnrollmentResponse;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.schoolrecords.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class EnrollmentServiceTest {

    private static final Capabilities ADMIN = Capabilities.all();

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private EnrollmentCascade enrollmentCascade;

    @Mock
    private AuditLogService auditLogService;

    private EnrollmentService enrollmentService;
    private Student student;
    private Course course;

    @BeforeEach
    void setUp() {
        enrollmentService = new EnrollmentService(
                enrollmentRepository,
                studentRepository,
                courseRepository,
                enrollmentCascade,
                auditLogService
        );
        student = TestEntities.student("STU20240001");
        course = TestEntities.course("MTH101", 3);
    }

    @Test
    @DisplayName("enroll persists the term enrollment and audits it")
    void enrollsStudent() {
        stubLookups();
        when(enrollmentRepository.saveAndFlush(any(Enrollment.class))).thenAnswer(invocation -> {
            Enrollment enrollment = invocation.getArgument(0);
            TestEntities.assignId(enrollment, UUID.randomUUID());
            return enrollment;
        });

        EnrollmentResponse response = enrollmentService.enroll(ADMIN,
                new EnrollCommand("STU20240001", "MTH101", " Fall ", "2024-2025"));

        assertThat(response.studentCode()).isEqualTo("STU20240001");
        assertThat(response.courseCode()).isEqualTo("MTH101");
        assertThat(response.semester()).isEqualTo("Fall");
        assertThat(response.creditHours()).isEqualTo(3);
        verify(auditLogService).record(any());
    }

    @Test
    @DisplayName("an existing term enrollment is a DUPLICATE_ENROLLMENT conflict")
    void rejectsDuplicateFromPreCheck() {
        stubLookups();
        when(enrollmentRepository.existsByStudentIdAndCourseIdAndSemesterAndAcademicYear(
                student.getId(), course.getId(), "Fall", "2024-2025")).thenReturn(true);

        assertThatThrownBy(() -> enrollmentService.enroll(ADMIN,
                new EnrollCommand("STU20240001", "MTH101", "Fall", "2024-2025")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("DUPLICATE_ENROLLMENT");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getDetailMessage()).contains("STU20240001", "MTH101", "Fall", "2024-2025");
                });
        verify(enrollmentRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("a concurrent duplicate caught by the unique index is translated")
    void translatesUniqueIndexViolation() {
        stubLookups();
        when(enrollmentRepository.saveAndFlush(any(Enrollment.class))).thenThrow(new DataIntegrityViolationException(
                "could not execute statement",
                new SQLException("duplicate key value violates unique constraint \""
                        + Enrollment.UNIQUE_TERM_CONSTRAINT + "\"")));

        assertThatThrownBy(() -> enrollmentService.enroll(ADMIN,
                new EnrollCommand("STU20240001", "MTH101", "Fall", "2024-2025")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("DUPLICATE_ENROLLMENT"));
        verifyNoInteractions(auditLogService);
    }

    @Test
    @DisplayName("the same course in another term is a separate enrollment")
    void allowsOtherTerm() {
        stubLookups();
        when(enrollmentRepository.existsByStudentIdAndCourseIdAndSemesterAndAcademicYear(
                student.getId(), course.getId(), "Spring", "2024-2025")).thenReturn(false);
        when(enrollmentRepository.saveAndFlush(any(Enrollment.class))).thenAnswer(invocation -> {
            Enrollment enrollment = invocation.getArgument(0);
            TestEntities.assignId(enrollment, UUID.randomUUID());
            return enrollment;
        });

        EnrollmentResponse response = enrollmentService.enroll(ADMIN,
                new EnrollCommand("STU20240001", "MTH101", "Spring", "2024-2025"));

        assertThat(response.semester()).isEqualTo("Spring");
    }

    @Test
    @DisplayName("unknown course fails with COURSE_NOT_FOUND")
    void unknownCourse() {
        when(studentRepository.findByStudentCode("STU20240001")).thenReturn(Optional.of(student));
        when(courseRepository.findByCode("XYZ999")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> enrollmentService.enroll(ADMIN,
                new EnrollCommand("STU20240001", "XYZ999", "Fall", "2024-2025")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("COURSE_NOT_FOUND"));
    }

    @Test
    @DisplayName("a teacher cannot enroll students")
    void teacherCannotEnroll() {
        Capabilities teacher = Capabilities.of(AcademicCapability.MARK_ATTENDANCE, AcademicCapability.RECORD_GRADES);

        assertThatThrownBy(() -> enrollmentService.enroll(teacher,
                new EnrollCommand("STU20240001", "MTH101", "Fall", "2024-2025")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("CAPABILITY_REQUIRED"));
        verifyNoInteractions(studentRepository, courseRepository, enrollmentRepository);
    }

    @Test
    @DisplayName("the term filter applies only when both labels are present")
    void listsWithOptionalTermFilter() {
        Enrollment fall = TestEntities.enrollment(student, course, "Fall", "2024-2025");
        when(studentRepository.findByStudentCode("STU20240001")).thenReturn(Optional.of(student));
        when(enrollmentRepository.findByStudentIdWithCourse(student.getId())).thenReturn(List.of(fall));
        when(enrollmentRepository.findTermEnrollmentsWithCourse(student.getId(), "Fall", "2024-2025"))
                .thenReturn(List.of(fall));

        assertThat(enrollmentService.listEnrollments("STU20240001", "Fall", null)).hasSize(1);
        assertThat(enrollmentService.listEnrollments("STU20240001", "Fall", "2024-2025"))
                .extracting(EnrollmentResponse::enrollmentId)
                .containsExactly(fall.getId());
        verify(enrollmentRepository).findByStudentIdWithCourse(student.getId());
    }

    @Test
    @DisplayName("withdraw locks the enrollment and delegates to the cascade")
    void withdrawsEnrollment() {
        Enrollment enrollment = TestEntities.enrollment(student, course, "Fall", "2024-2025");
        when(enrollmentRepository.findByIdForUpdate(enrollment.getId())).thenReturn(Optional.of(enrollment));
        when(enrollmentCascade.removeEnrollment(enrollment)).thenReturn(new CascadeResult(1, 1, 0, 0));

        enrollmentService.withdraw(ADMIN, enrollment.getId());

        verify(enrollmentCascade).removeEnrollment(enrollment);
        verify(auditLogService).record(any());
    }

    private void stubLookups() {
        when(studentRepository.findByStudentCode("STU20240001")).thenReturn(Optional.of(student));
        when(courseRepository.findByCode("MTH101")).thenReturn(Optional.of(course));
    }
}
