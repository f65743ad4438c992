package com.schoolrecords.backend.modules.enrollment.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;

public interface EnrollmentRepository extends JpaRepository<Enrollment, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Enrollment e where e.id = :id")
    Optional<Enrollment> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByStudentIdAndCourseIdAndSemesterAndAcademicYear(
            UUID studentId,
            UUID courseId,
            String semester,
            String academicYear);

    boolean existsByStudentIdAndCourseId(UUID studentId, UUID courseId);

    @Query("""
            select e
              from Enrollment e
              join fetch e.course c
             where e.student.id = :studentId
             order by e.academicYear asc, e.semester asc, c.code asc
            """)
    List<Enrollment> findByStudentIdWithCourse(@Param("studentId") UUID studentId);

    @Query("""
            select e
              from Enrollment e
              join fetch e.course c
             where e.student.id = :studentId
               and e.semester = :semester
               and e.academicYear = :academicYear
             order by c.code asc
            """)
    List<Enrollment> findTermEnrollmentsWithCourse(
            @Param("studentId") UUID studentId,
            @Param("semester") String semester,
            @Param("academicYear") String academicYear);

    @Query("select e from Enrollment e join fetch e.student join fetch e.course where e.student.id = :studentId")
    List<Enrollment> findByStudentIdWithStudentAndCourse(@Param("studentId") UUID studentId);

    @Query("select e from Enrollment e join fetch e.student join fetch e.course where e.course.id = :courseId")
    List<Enrollment> findByCourseIdWithStudentAndCourse(@Param("courseId") UUID courseId);
}
