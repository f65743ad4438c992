package com.schoolrecords.backend.modules.report.application;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.schoolrecords.backend.modules.attendance.application.AttendanceService;
import com.schoolrecords.backend.modules.attendance.domain.Attendance;
import com.schoolrecords.backend.modules.attendance.domain.AttendanceStatus;
import com.schoolrecords.backend.modules.attendance.infrastructure.persistence.AttendanceRepository;
import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;
import com.schoolrecords.backend.modules.enrollment.infrastructure.persistence.EnrollmentRepository;
import com.schoolrecords.backend.modules.grade.domain.Grade;
import com.schoolrecords.backend.modules.grade.infrastructure.persistence.GradeRepository;
import com.schoolrecords.backend.modules.report.domain.AttendanceSummary;
import com.schoolrecords.backend.modules.report.domain.ReportCalculations;
import com.schoolrecords.backend.modules.report.domain.ReportCard;
import com.schoolrecords.backend.modules.report.domain.ReportCardEntry;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;

/**
 * Read-only projections over enrollments, grades and attendance. Unknown
 * students or courses produce empty results instead of errors, so a report
 * requested after a cascade delete is well defined.
 */
@Service
@Transactional(readOnly = true)
public class ReportService {

    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final GradeRepository gradeRepository;
    private final AttendanceRepository attendanceRepository;

    public ReportService(
            StudentRepository studentRepository,
            CourseRepository courseRepository,
            EnrollmentRepository enrollmentRepository,
            GradeRepository gradeRepository,
            AttendanceRepository attendanceRepository
    ) {
        this.studentRepository = studentRepository;
        this.courseRepository = courseRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.gradeRepository = gradeRepository;
        this.attendanceRepository = attendanceRepository;
    }

    public ReportCard buildReportCard(String studentCode, String semesterLabel, String academicYearLabel) {
        String semester = trimLabel(semesterLabel);
        String academicYear = trimLabel(academicYearLabel);
        Optional<Student> found = studentRepository.findByStudentCode(studentCode);
        if (found.isEmpty()) {
            return ReportCard.empty(studentCode, semester, academicYear);
        }
        Student student = found.get();

        List<Enrollment> enrollments = enrollmentRepository.findTermEnrollmentsWithCourse(
                student.getId(), semester, academicYear);
        if (enrollments.isEmpty()) {
            return ReportCard.of(studentCode, student.getFullName(), semester, academicYear, List.of());
        }

        List<UUID> enrollmentIds = enrollments.stream().map(Enrollment::getId).toList();
        Map<UUID, Grade> gradesByEnrollment = gradeRepository.findByEnrollmentIdIn(enrollmentIds).stream()
                .collect(Collectors.toMap(grade -> grade.getEnrollment().getId(), Function.identity()));

        List<ReportCardEntry> entries = new ArrayList<>();
        for (Enrollment enrollment : enrollments) {
            Grade grade = gradesByEnrollment.get(enrollment.getId());
            if (grade == null) {
                continue;
            }
            Course course = enrollment.getCourse();
            entries.add(new ReportCardEntry(
                    course.getCode(),
                    course.getName(),
                    course.getCreditHours(),
                    grade.getMarks(),
                    grade.getLetterGrade(),
                    grade.getRemark()
            ));
        }
        return ReportCard.of(studentCode, student.getFullName(), semester, academicYear, entries);
    }

    public AttendanceSummary buildAttendanceSummary(String studentCode, String courseCode, LocalDate from, LocalDate to) {
        AttendanceService.requireRange(from, to);
        Optional<Student> student = studentRepository.findByStudentCode(studentCode);
        Optional<Course> course = courseRepository.findByCode(courseCode);

        Map<AttendanceStatus, Long> counts = new EnumMap<>(AttendanceStatus.class);
        for (AttendanceStatus status : AttendanceStatus.values()) {
            counts.put(status, 0L);
        }
        long total = 0;
        if (student.isPresent() && course.isPresent()) {
            List<Attendance> rows = attendanceRepository
                    .findByStudentIdAndCourseIdAndAttendanceDateBetweenOrderByAttendanceDateAsc(
                            student.get().getId(), course.get().getId(), from, to);
            for (Attendance row : rows) {
                counts.merge(row.getStatus(), 1L, Long::sum);
            }
            total = rows.size();
        }

        long present = counts.get(AttendanceStatus.PRESENT);
        return new AttendanceSummary(
                studentCode,
                courseCode,
                from,
                to,
                total,
                present,
                counts.get(AttendanceStatus.ABSENT),
                counts.get(AttendanceStatus.LATE),
                counts.get(AttendanceStatus.EXCUSED),
                ReportCalculations.percentage(present, total)
        );
    }

    private static String trimLabel(String value) {
        return StringUtils.hasText(value) ? value.trim() : value;
    }
}
