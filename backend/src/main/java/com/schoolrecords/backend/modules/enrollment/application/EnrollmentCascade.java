package com.schoolrecords.backend.modules.enrollment.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.schoolrecords.backend.modules.attendance.infrastructure.persistence.AttendanceRepository;
import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;
import com.schoolrecords.backend.modules.enrollment.infrastructure.persistence.EnrollmentRepository;
import com.schoolrecords.backend.modules.grade.infrastructure.persistence.GradeRepository;
import com.schoolrecords.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;

/**
 * Explicit delete order for records hanging off students and courses:
 * grades, then attendance of each enrolled pair, then enrollments, then any
 * attendance left without an enrollment, and finally the root row. Every step
 * is a bulk delete, so re-running a partially applied cascade is harmless.
 */
@Component
@Transactional(propagation = Propagation.MANDATORY)
public class EnrollmentCascade {

    private final EnrollmentRepository enrollmentRepository;
    private final GradeRepository gradeRepository;
    private final AttendanceRepository attendanceRepository;
    private final NotificationRepository notificationRepository;
    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;

    public EnrollmentCascade(
            EnrollmentRepository enrollmentRepository,
            GradeRepository gradeRepository,
            AttendanceRepository attendanceRepository,
            NotificationRepository notificationRepository,
            StudentRepository studentRepository,
            CourseRepository courseRepository
    ) {
        this.enrollmentRepository = enrollmentRepository;
        this.gradeRepository = gradeRepository;
        this.attendanceRepository = attendanceRepository;
        this.notificationRepository = notificationRepository;
        this.studentRepository = studentRepository;
        this.courseRepository = courseRepository;
    }

    public CascadeResult removeStudent(Student student) {
        List<Enrollment> enrollments = enrollmentRepository.findByStudentIdWithStudentAndCourse(student.getId());
        CascadeResult partial = removeEnrollments(enrollments);

        int strayAttendance = attendanceRepository.deleteByStudentId(student.getId());
        int notifications = notificationRepository.deleteByStudentId(student.getId());
        studentRepository.delete(student);
        return partial.plus(strayAttendance, notifications);
    }

    public CascadeResult removeCourse(Course course) {
        List<Enrollment> enrollments = enrollmentRepository.findByCourseIdWithStudentAndCourse(course.getId());
        CascadeResult partial = removeEnrollments(enrollments);

        int strayAttendance = attendanceRepository.deleteByCourseId(course.getId());
        courseRepository.delete(course);
        return partial.plus(strayAttendance, 0);
    }

    /**
     * Withdraws a single enrollment. Attendance of the pair survives while the
     * student still holds another enrollment in the same course.
     */
    public CascadeResult removeEnrollment(Enrollment enrollment) {
        UUID studentId = enrollment.getStudent().getId();
        UUID courseId = enrollment.getCourse().getId();

        int grades = gradeRepository.deleteByEnrollmentIds(List.of(enrollment.getId()));
        enrollmentRepository.delete(enrollment);
        enrollmentRepository.flush();

        int attendance = 0;
        if (!enrollmentRepository.existsByStudentIdAndCourseId(studentId, courseId)) {
            attendance = attendanceRepository.deleteByStudentIdAndCourseId(studentId, courseId);
        }
        return new CascadeResult(1, grades, attendance, 0);
    }

    private CascadeResult removeEnrollments(List<Enrollment> enrollments) {
        if (enrollments.isEmpty()) {
            return CascadeResult.EMPTY;
        }
        List<UUID> enrollmentIds = new ArrayList<>(enrollments.size());
        Set<StudentCoursePair> pairs = new LinkedHashSet<>();
        for (Enrollment enrollment : enrollments) {
            enrollmentIds.add(enrollment.getId());
            pairs.add(new StudentCoursePair(enrollment.getStudent().getId(), enrollment.getCourse().getId()));
        }

        int grades = gradeRepository.deleteByEnrollmentIds(enrollmentIds);
        int attendance = 0;
        for (StudentCoursePair pair : pairs) {
            attendance += attendanceRepository.deleteByStudentIdAndCourseId(pair.studentId(), pair.courseId());
        }
        enrollmentRepository.deleteAllInBatch(enrollments);
        return new CascadeResult(enrollments.size(), grades, attendance, 0);
    }

    private record StudentCoursePair(UUID studentId, UUID courseId) {
    }

    public record CascadeResult(int enrollments, int grades, int attendance, int notifications) {

        static final CascadeResult EMPTY = new CascadeResult(0, 0, 0, 0);

        CascadeResult plus(int extraAttendance, int extraNotifications) {
            return new CascadeResult(enrollments, grades, attendance + extraAttendance, notifications + extraNotifications);
        }

        public Map<String, Object> toDetail() {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("enrollments", enrollments);
            detail.put("grades", grades);
            detail.put("attendance", attendance);
            detail.put("notifications", notifications);
            return detail;
        }
    }
}
