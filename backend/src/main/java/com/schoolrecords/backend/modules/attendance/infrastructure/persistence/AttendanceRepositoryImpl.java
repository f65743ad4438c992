package com.schoolrecords.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import org.springframework.stereotype.Repository;

import com.schoolrecords.backend.modules.attendance.domain.AttendanceStatus;
import com.schoolrecords.backend.modules.attendance.domain.UpsertOutcome;

@Repository
public class AttendanceRepositoryImpl implements AttendanceRepositoryCustom {

    // xmax is 0 only for a tuple created by this statement
    private static final String UPSERT_SQL = """
            INSERT INTO attendance (id, student_id, course_id, attendance_date, status, remark, created_at, updated_at)
            VALUES (gen_random_uuid(), :studentId, :courseId, :attendanceDate, :status, :remark, :writtenAt, :writtenAt)
            ON CONFLICT (student_id, course_id, attendance_date)
            DO UPDATE SET status = EXCLUDED.status,
                          remark = EXCLUDED.remark,
                          updated_at = EXCLUDED.updated_at
            RETURNING (xmax = 0) AS inserted
            """;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public UpsertOutcome upsert(
            UUID studentId,
            UUID courseId,
            LocalDate attendanceDate,
            AttendanceStatus status,
            String remark,
            OffsetDateTime writtenAt
    ) {
        Objects.requireNonNull(studentId, "studentId must not be null");
        Objects.requireNonNull(courseId, "courseId must not be null");
        Objects.requireNonNull(attendanceDate, "attendanceDate must not be null");
        Objects.requireNonNull(status, "status must not be null");

        Object inserted = entityManager.createNativeQuery(UPSERT_SQL)
                .setParameter("studentId", studentId)
                .setParameter("courseId", courseId)
                .setParameter("attendanceDate", attendanceDate)
                .setParameter("status", status.name())
                .setParameter("remark", remark)
                .setParameter("writtenAt", writtenAt)
                .getSingleResult();
        return Boolean.TRUE.equals(inserted) ? UpsertOutcome.INSERTED : UpsertOutcome.UPDATED;
    }
}
