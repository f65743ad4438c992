package com.schoolrecords.backend.modules.course.application;

import java.util.List;
import java.util.Map;

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
import com.schoolrecords.backend.modules.course.presentation.dto.CourseDtoMapper;
import com.schoolrecords.backend.modules.course.presentation.dto.CourseResponse;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade.CascadeResult;

@Service
@Transactional
public class CourseService {

    private static final String COURSE_CODE_CONSTRAINT = "uq_course_code";

    private final CourseRepository courseRepository;
    private final EnrollmentCascade enrollmentCascade;
    private final AuditLogService auditLogService;

    public CourseService(
            CourseRepository courseRepository,
            EnrollmentCascade enrollmentCascade,
            AuditLogService auditLogService
    ) {
        this.courseRepository = courseRepository;
        this.enrollmentCascade = enrollmentCascade;
        this.auditLogService = auditLogService;
    }

    public CourseResponse createCourse(Capabilities capabilities, CreateCourseCommand command) {
        capabilities.require(AcademicCapability.MANAGE_RECORDS);
        if (!StringUtils.hasText(command.code()) || !StringUtils.hasText(command.name())
                || !StringUtils.hasText(command.department())) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "code, name and department are required");
        }
        if (command.creditHours() <= 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "creditHours must be positive: " + command.creditHours());
        }
        String code = command.code().trim();
        if (courseRepository.existsByCode(code)) {
            throw duplicateCode(code, null);
        }

        Course saved;
        try {
            saved = courseRepository.saveAndFlush(new Course(
                    code,
                    command.name().trim(),
                    command.creditHours(),
                    command.department().trim()
            ));
        } catch (DataIntegrityViolationException ex) {
            String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
            if (message != null && message.contains(COURSE_CODE_CONSTRAINT)) {
                throw duplicateCode(code, ex);
            }
            throw ex;
        }

        auditLogService.record(new AuditLogCommand(
                "COURSE_CREATED",
                AuditLogService.RESOURCE_COURSE,
                code,
                Map.of("creditHours", saved.getCreditHours(), "department", saved.getDepartment())
        ));
        return CourseDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public CourseResponse getCourse(String code) {
        return CourseDtoMapper.toResponse(loadCourse(code));
    }

    @Transactional(readOnly = true)
    public List<CourseResponse> listCourses(String department) {
        List<Course> courses = StringUtils.hasText(department)
                ? courseRepository.findByDepartmentOrderByCodeAsc(department.trim())
                : courseRepository.findAllByOrderByCodeAsc();
        return courses.stream()
                .map(CourseDtoMapper::toResponse)
                .toList();
    }

    public void deleteCourse(Capabilities capabilities, String code) {
        capabilities.require(AcademicCapability.MANAGE_RECORDS);
        Course course = loadCourse(code);
        CascadeResult result = enrollmentCascade.removeCourse(course);
        auditLogService.record(new AuditLogCommand(
                "COURSE_DELETED",
                AuditLogService.RESOURCE_COURSE,
                course.getCode(),
                result.toDetail()
        ));
    }

    private Course loadCourse(String code) {
        return courseRepository.findByCode(code)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "COURSE_NOT_FOUND",
                        "course " + code + " does not exist"));
    }

    private ProblemException duplicateCode(String code, Throwable cause) {
        return new ProblemException(HttpStatus.CONFLICT, "DUPLICATE_COURSE_CODE",
                "course code " + code + " is already taken", cause);
    }

    public record CreateCourseCommand(
            String code,
            String name,
            int creditHours,
            String department
    ) {
    }
}
