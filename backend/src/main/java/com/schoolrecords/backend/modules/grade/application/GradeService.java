package com.schoolrecords.backend.modules.grade.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

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
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;
import com.schoolrecords.backend.modules.enrollment.infrastructure.persistence.EnrollmentRepository;
import com.schoolrecords.backend.modules.grade.domain.Grade;
import com.schoolrecords.backend.modules.grade.infrastructure.persistence.GradeRepository;
import com.schoolrecords.backend.modules.grade.presentation.dto.GradeDtoMapper;
import com.schoolrecords.backend.modules.grade.presentation.dto.GradeResponse;
import com.schoolrecords.backend.modules.notification.application.NotificationService;

@Service
@Transactional
public class GradeService {

    private static final BigDecimal MAX_MARKS = BigDecimal.valueOf(100);
    private static final int MARKS_SCALE = 2;

    private final GradeRepository gradeRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final NotificationService notificationService;
    private final AuditLogService auditLogService;

    public GradeService(
            GradeRepository gradeRepository,
            EnrollmentRepository enrollmentRepository,
            NotificationService notificationService,
            AuditLogService auditLogService
    ) {
        this.gradeRepository = gradeRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.notificationService = notificationService;
        this.auditLogService = auditLogService;
    }

    /**
     * Creates or replaces the grade of an enrollment. The enrollment row is
     * locked first, so two recordings for the same enrollment never both insert.
     */
    public GradeResponse recordGrade(Capabilities capabilities, UUID enrollmentId, BigDecimal marks, String remark) {
        capabilities.require(AcademicCapability.RECORD_GRADES);
        BigDecimal normalizedMarks = normalizeMarks(enrollmentId, marks);

        Enrollment enrollment = enrollmentRepository.findByIdForUpdate(enrollmentId)
                .orElseThrow(() -> enrollmentNotFound(enrollmentId));
        Grade grade = gradeRepository.findByEnrollmentId(enrollmentId)
                .orElseGet(() -> new Grade(enrollment));
        boolean replaced = grade.getId() != null;
        grade.assign(normalizedMarks, StringUtils.hasText(remark) ? remark.trim() : null);
        Grade saved = gradeRepository.save(grade);

        Course course = enrollment.getCourse();
        notificationService.notifyStudent(
                enrollment.getStudent(),
                NotificationService.KIND_GRADE_POSTED,
                "Grade posted for " + course.getCode(),
                "%s %s (%s %s): %s (%s)".formatted(
                        course.getCode(),
                        course.getName(),
                        enrollment.getSemester(),
                        enrollment.getAcademicYear(),
                        normalizedMarks.toPlainString(),
                        saved.getLetterGrade().name())
        );

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("marks", normalizedMarks.toPlainString());
        detail.put("letterGrade", saved.getLetterGrade().name());
        detail.put("replaced", replaced);
        auditLogService.record(new AuditLogCommand(
                replaced ? "GRADE_REPLACED" : "GRADE_RECORDED",
                AuditLogService.RESOURCE_ENROLLMENT,
                enrollmentId.toString(),
                detail
        ));
        return GradeDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public GradeResponse getGrade(UUID enrollmentId) {
        if (!enrollmentRepository.existsById(enrollmentId)) {
            throw enrollmentNotFound(enrollmentId);
        }
        Grade grade = gradeRepository.findByEnrollmentId(enrollmentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "GRADE_NOT_FOUND",
                        "enrollment " + enrollmentId + " has no grade"));
        return GradeDtoMapper.toResponse(grade);
    }

    private static BigDecimal normalizeMarks(UUID enrollmentId, BigDecimal marks) {
        if (marks == null) {
            throw invalidScore(enrollmentId, "marks are required");
        }
        if (marks.signum() < 0 || marks.compareTo(MAX_MARKS) > 0) {
            throw invalidScore(enrollmentId, "marks must be within [0, 100]: " + marks.toPlainString());
        }
        if (marks.stripTrailingZeros().scale() > MARKS_SCALE) {
            throw invalidScore(enrollmentId, "marks allow at most two decimals: " + marks.toPlainString());
        }
        return marks.setScale(MARKS_SCALE, RoundingMode.UNNECESSARY);
    }

    private static ProblemException invalidScore(UUID enrollmentId, String reason) {
        return new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_SCORE",
                reason + " (enrollment " + enrollmentId + ")");
    }

    private static ProblemException enrollmentNotFound(UUID enrollmentId) {
        return new ProblemException(HttpStatus.NOT_FOUND, "ENROLLMENT_NOT_FOUND",
                "enrollment " + enrollmentId + " does not exist");
    }
}
