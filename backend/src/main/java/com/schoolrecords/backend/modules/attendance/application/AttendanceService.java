package com.schoolrecords.backend.modules.attendance.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.schoolrecords.backend.global.error.ProblemException;
import com.schoolrecords.backend.global.security.AcademicCapability;
import com.schoolrecords.backend.global.security.Capabilities;
import com.schoolrecords.backend.modules.attendance.domain.AttendanceStatus;
import com.schoolrecords.backend.modules.attendance.domain.UpsertOutcome;
import com.schoolrecords.backend.modules.attendance.infrastructure.persistence.AttendanceRepository;
import com.schoolrecords.backend.modules.attendance.presentation.dto.AttendanceRecordResponse;
import com.schoolrecords.backend.modules.audit.application.AuditLogService;
import com.schoolrecords.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;

@Service
@Transactional
public class AttendanceService {

    private final AttendanceRepository attendanceRepository;
    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AttendanceService(
            AttendanceRepository attendanceRepository,
            StudentRepository studentRepository,
            CourseRepository courseRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.attendanceRepository = attendanceRepository;
        this.studentRepository = studentRepository;
        this.courseRepository = courseRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * Upserts one row per entry, in order. The batch is not atomic: when an
     * entry names an unknown student the call fails, and the entries before it
     * stay committed. Re-sending the same batch converges to the same rows.
     */
    @Transactional(noRollbackFor = ProblemException.class)
    public MarkResult markAttendance(
            Capabilities capabilities,
            String courseCode,
            LocalDate date,
            List<AttendanceEntry> entries
    ) {
        capabilities.require(AcademicCapability.MARK_ATTENDANCE);
        if (date == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "attendance date is required");
        }
        Course course = courseRepository.findByCode(courseCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "COURSE_NOT_FOUND",
                        "course " + courseCode + " does not exist"));

        OffsetDateTime writtenAt = OffsetDateTime.now(clock);
        List<MarkedEntry> marked = new ArrayList<>(entries.size());
        try {
            for (AttendanceEntry entry : entries) {
                if (entry.status() == null) {
                    throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                            "status is required for student " + entry.studentCode());
                }
                Student student = studentRepository.findByStudentCode(entry.studentCode())
                        .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STUDENT_NOT_FOUND",
                                "student %s does not exist; %d of %d entries were applied"
                                        .formatted(entry.studentCode(), marked.size(), entries.size())));
                String remark = StringUtils.hasText(entry.remark()) ? entry.remark().trim() : null;
                UpsertOutcome outcome = attendanceRepository.upsert(
                        student.getId(), course.getId(), date, entry.status(), remark, writtenAt);
                marked.add(new MarkedEntry(student.getStudentCode(), entry.status(), outcome));
            }
        } catch (ProblemException ex) {
            if (!marked.isEmpty()) {
                recordBatch(course, date, marked, entries.size());
            }
            throw ex;
        }
        if (!marked.isEmpty()) {
            recordBatch(course, date, marked, entries.size());
        }
        return new MarkResult(course.getCode(), date, List.copyOf(marked));
    }

    @Transactional(readOnly = true)
    public List<AttendanceRecordResponse> getAttendance(String studentCode, String courseCode, LocalDate from, LocalDate to) {
        requireRange(from, to);
        Student student = studentRepository.findByStudentCode(studentCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STUDENT_NOT_FOUND",
                        "student " + studentCode + " does not exist"));
        Course course = courseRepository.findByCode(courseCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "COURSE_NOT_FOUND",
                        "course " + courseCode + " does not exist"));
        return attendanceRepository
                .findByStudentIdAndCourseIdAndAttendanceDateBetweenOrderByAttendanceDateAsc(
                        student.getId(), course.getId(), from, to)
                .stream()
                .map(row -> new AttendanceRecordResponse(row.getAttendanceDate(), row.getStatus().name(), row.getRemark()))
                .toList();
    }

    public static void requireRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "from and to are required");
        }
        if (from.isAfter(to)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "from " + from + " is after to " + to);
        }
    }

    private void recordBatch(Course course, LocalDate date, List<MarkedEntry> marked, int requested) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("date", date.toString());
        detail.put("requested", requested);
        detail.put("applied", marked.size());
        detail.put("inserted", marked.stream().filter(entry -> entry.outcome() == UpsertOutcome.INSERTED).count());
        auditLogService.record(new AuditLogCommand(
                "ATTENDANCE_MARKED",
                AuditLogService.RESOURCE_ATTENDANCE,
                course.getCode(),
                detail
        ));
    }

    public record AttendanceEntry(String studentCode, AttendanceStatus status, String remark) {
    }

    public record MarkedEntry(String studentCode, AttendanceStatus status, UpsertOutcome outcome) {
    }

    public record MarkResult(String courseCode, LocalDate date, List<MarkedEntry> entries) {

        public long count(UpsertOutcome outcome) {
            return entries.stream().filter(entry -> entry.outcome() == outcome).count();
        }
    }
}
