package com.schoolrecords.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.schoolrecords.backend.modules.attendance.domain.Attendance;

public interface AttendanceRepository extends JpaRepository<Attendance, UUID>, AttendanceRepositoryCustom {

    List<Attendance> findByStudentIdAndCourseIdAndAttendanceDateBetweenOrderByAttendanceDateAsc(
            UUID studentId,
            UUID courseId,
            LocalDate from,
            LocalDate to);

    @Modifying
    @Query("delete from Attendance a where a.student.id = :studentId and a.course.id = :courseId")
    int deleteByStudentIdAndCourseId(@Param("studentId") UUID studentId, @Param("courseId") UUID courseId);

    @Modifying
    @Query("delete from Attendance a where a.student.id = :studentId")
    int deleteByStudentId(@Param("studentId") UUID studentId);

    @Modifying
    @Query("delete from Attendance a where a.course.id = :courseId")
    int deleteByCourseId(@Param("courseId") UUID courseId);
}
