package com.schoolrecords.backend.modules.enrollment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import com.schoolrecords.backend.modules.attendance.infrastructure.persistence.AttendanceRepository;
import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade;
import com.schoolrecords.backend.modules.enrollment.application.EnrollmentCascade.CascadeResult;
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;
import com.schoolrecords.backend.modules.enrollment.infrastructure.persistence.EnrollmentRepository;
import com.schoolrecords.backend.modules.grade.infrastructure.persistence.GradeRepository;
import com.schoolrecords.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.schoolrecords.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EnrollmentCascadeTest {

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private GradeRepository gradeRepository;

    @Mock
    private AttendanceRepository attendanceRepository;

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private CourseRepository courseRepository;

    private EnrollmentCascade cascade;
    private Student student;
    private Course math;
    private Course physics;

    @BeforeEach
    void setUp() {
        cascade = new EnrollmentCascade(
                enrollmentRepository,
                gradeRepository,
                attendanceRepository,
                notificationRepository,
                studentRepository,
                courseRepository
        );
        student = TestEntities.student("STU20240001");
        math = TestEntities.course("MTH101", 3);
        physics = TestEntities.course("PHY101", 4);
    }

    @Test
    @DisplayName("student removal deletes grades, attendance and enrollments before the student")
    void removesStudentInDependencyOrder() {
        Enrollment fall = TestEntities.enrollment(student, math, "Fall", "2024-2025");
        Enrollment spring = TestEntities.enrollment(student, math, "Spring", "2024-2025");
        Enrollment lab = TestEntities.enrollment(student, physics, "Fall", "2024-2025");
        List<Enrollment> enrollments = List.of(fall, spring, lab);
        when(enrollmentRepository.findByStudentIdWithStudentAndCourse(student.getId())).thenReturn(enrollments);
        when(gradeRepository.deleteByEnrollmentIds(List.of(fall.getId(), spring.getId(), lab.getId()))).thenReturn(2);
        when(attendanceRepository.deleteByStudentIdAndCourseId(student.getId(), math.getId())).thenReturn(6);
        when(attendanceRepository.deleteByStudentIdAndCourseId(student.getId(), physics.getId())).thenReturn(3);
        when(attendanceRepository.deleteByStudentId(student.getId())).thenReturn(1);
        when(notificationRepository.deleteByStudentId(student.getId())).thenReturn(4);

        CascadeResult result = cascade.removeStudent(student);

        assertThat(result).isEqualTo(new CascadeResult(3, 2, 10, 4));
        InOrder order = inOrder(gradeRepository, attendanceRepository, enrollmentRepository,
                notificationRepository, studentRepository);
        order.verify(gradeRepository).deleteByEnrollmentIds(List.of(fall.getId(), spring.getId(), lab.getId()));
        order.verify(attendanceRepository).deleteByStudentIdAndCourseId(student.getId(), math.getId());
        order.verify(attendanceRepository).deleteByStudentIdAndCourseId(student.getId(), physics.getId());
        order.verify(enrollmentRepository).deleteAllInBatch(enrollments);
        order.verify(attendanceRepository).deleteByStudentId(student.getId());
        order.verify(notificationRepository).deleteByStudentId(student.getId());
        order.verify(studentRepository).delete(student);
    }

    @Test
    @DisplayName("a student without enrollments skips the grade delete")
    void removesStudentWithoutEnrollments() {
        when(enrollmentRepository.findByStudentIdWithStudentAndCourse(student.getId())).thenReturn(List.of());

        CascadeResult result = cascade.removeStudent(student);

        assertThat(result.enrollments()).isZero();
        verify(gradeRepository, never()).deleteByEnrollmentIds(anyCollection());
        verify(studentRepository).delete(student);
    }

    @Test
    @DisplayName("course removal clears attendance of every enrolled student and the course itself")
    void removesCourse() {
        Student other = TestEntities.student("STU20240002");
        Enrollment first = TestEntities.enrollment(student, math, "Fall", "2024-2025");
        Enrollment second = TestEntities.enrollment(other, math, "Fall", "2024-2025");
        when(enrollmentRepository.findByCourseIdWithStudentAndCourse(math.getId())).thenReturn(List.of(first, second));

        cascade.removeCourse(math);

        verify(attendanceRepository).deleteByStudentIdAndCourseId(student.getId(), math.getId());
        verify(attendanceRepository).deleteByStudentIdAndCourseId(other.getId(), math.getId());
        verify(attendanceRepository).deleteByCourseId(math.getId());
        verify(courseRepository).delete(math);
        verify(notificationRepository, never()).deleteByStudentId(student.getId());
    }

    @Test
    @DisplayName("withdraw keeps attendance while another enrollment of the pair remains")
    void withdrawKeepsSharedAttendance() {
        Enrollment fall = TestEntities.enrollment(student, math, "Fall", "2024-2025");
        when(enrollmentRepository.existsByStudentIdAndCourseId(student.getId(), math.getId())).thenReturn(true);

        CascadeResult result = cascade.removeEnrollment(fall);

        assertThat(result.attendance()).isZero();
        verify(gradeRepository).deleteByEnrollmentIds(List.of(fall.getId()));
        verify(enrollmentRepository).delete(fall);
        verify(attendanceRepository, never()).deleteByStudentIdAndCourseId(student.getId(), math.getId());
    }

    @Test
    @DisplayName("withdraw of the last enrollment of the pair removes its attendance")
    void withdrawRemovesAttendanceOfLastEnrollment() {
        Enrollment fall = TestEntities.enrollment(student, math, "Fall", "2024-2025");
        when(enrollmentRepository.existsByStudentIdAndCourseId(student.getId(), math.getId())).thenReturn(false);
        when(attendanceRepository.deleteByStudentIdAndCourseId(student.getId(), math.getId())).thenReturn(5);

        CascadeResult result = cascade.removeEnrollment(fall);

        assertThat(result.attendance()).isEqualTo(5);
    }
}
