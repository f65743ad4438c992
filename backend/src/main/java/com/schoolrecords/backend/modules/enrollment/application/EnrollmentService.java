package com.schoolrecords.backend.modules.enrollment.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.schoolrecords.backend.global.error.ProblemException;
import com.schoolrecords.backend.global.security.AcademicCapability;
import com.schoolrecords.backend.global.security.Capabilities;
import com.schoolrecords.backend.modules.audit.application.AuditLogService;
import com.schoolrecords.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade.CascadeResult;
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;
import com.schoolrecords.backend.modules.enrollment.infrastructure.persistence.EnrollmentRepository;
import com.schoolrecords.backend.modules.enrollment.presentation.dto.EnrollmentDtoMapper;
import com.schoolrecords.backend.modules.enrollment.presentation.dto.EnrollmentResponse;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;

@Service
@Transactional
public class EnrollmentService {

    private final EnrollmentRepository enrollmentRepository;
    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final EnrollmentCascade enrollmentCascade;
    private final AuditLogService auditLogService;

    public EnrollmentService(
            EnrollmentRepository enrollmentRepository,
            StudentRepository studentRepository,
            CourseRepository courseRepository,
            EnrollmentCascade enrollmentCascade,
            AuditLogService auditLogService
    ) {
        this.enrollmentRepository = enrollmentRepository;
        this.studentRepository = studentRepository;
        this.courseRepository = courseRepository;
        this.enrollmentCascade = enrollmentCascade;
        this.auditLogService = auditLogService;
    }

    public EnrollmentResponse enroll(Capabilities capabilities, EnrollCommand command) {
        capabilities.require(AcademicCapability.ENROLL_STUDENTS);
        String semester = requireLabel(command.semester(), "semester");
        String academicYear = requireLabel(command.academicYear(), "academicYear");

        Student student = studentRepository.findByStudentCode(command.studentCode())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STUDENT_NOT_FOUND",
                        "student " + command.studentCode() + " does not exist"));
        Course course = courseRepository.findByCode(command.courseCode())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "COURSE_NOT_FOUND",
                        "course " + command.courseCode() + " does not exist"));

        if (enrollmentRepository.existsByStudentIdAndCourseIdAndSemesterAndAcademicYear(
                student.getId(), course.getId(), semester, academicYear)) {
            throw duplicateEnrollment(student, course, semester, academicYear, null);
        }

        Enrollment saved;
        try {
            saved = enrollmentRepository.saveAndFlush(new Enrollment(student, course, semester, academicYear));
        } catch (DataIntegrityViolationException ex) {
            if (isUniqueTermViolation(ex)) {
                throw duplicateEnrollment(student, course, semester, academicYear, ex);
            }
            throw ex;
        }

        auditLogService.record(new AuditLogCommand(
                "ENROLLMENT_CREATED",
                AuditLogService.RESOURCE_ENROLLMENT,
                saved.getId().toString(),
                Map.of(
                        "studentCode", student.getStudentCode(),
                        "courseCode", course.getCode(),
                        "semester", semester,
                        "academicYear", academicYear
                )
        ));
        return EnrollmentDtoMapper.toResponse(saved);
    }

    /**
     * Lists the student's enrollments, optionally narrowed to one term. The
     * term filter applies only when both labels are given.
     */
    @Transactional(readOnly = true)
    public List<EnrollmentResponse> listEnrollments(String studentCode, String semester, String academicYear) {
        Student student = studentRepository.findByStudentCode(studentCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STUDENT_NOT_FOUND",
                        "student " + studentCode + " does not exist"));
        List<Enrollment> enrollments = StringUtils.hasText(semester) && StringUtils.hasText(academicYear)
                ? enrollmentRepository.findTermEnrollmentsWithCourse(student.getId(), semester.trim(), academicYear.trim())
                : enrollmentRepository.findByStudentIdWithCourse(student.getId());
        return enrollments.stream()
                .map(EnrollmentDtoMapper::toResponse)
                .toList();
    }

    public void withdraw(Capabilities capabilities, UUID enrollmentId) {
        capabilities.require(AcademicCapability.ENROLL_STUDENTS);
        Enrollment enrollment = enrollmentRepository.findByIdForUpdate(enrollmentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ENROLLMENT_NOT_FOUND",
                        "enrollment " + enrollmentId + " does not exist"));
        CascadeResult result = enrollmentCascade.removeEnrollment(enrollment);
        auditLogService.record(new AuditLogCommand(
                "ENROLLMENT_WITHDRAWN",
                AuditLogService.RESOURCE_ENROLLMENT,
                enrollmentId.toString(),
                result.toDetail()
        ));
    }

    private ProblemException duplicateEnrollment(
            Student student,
            Course course,
            String semester,
            String academicYear,
            Throwable cause
    ) {
        String detail = "student %s is already enrolled in %s for %s %s"
                .formatted(student.getStudentCode(), course.getCode(), semester, academicYear);
        return new ProblemException(HttpStatus.CONFLICT, "DUPLICATE_ENROLLMENT", detail, cause);
    }

    private boolean isUniqueTermViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(Enrollment.UNIQUE_TERM_CONSTRAINT);
    }

    private static String requireLabel(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", field + " is required");
        }
        return value.trim();
    }

    public record EnrollCommand(
            String studentCode,
            String courseCode,
            String semester,
            String academicYear
    ) {
    }
}
