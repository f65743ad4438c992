package com.schoolrecords.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.schoolrecords.backend.modules.attendance.domain.AttendanceStatus;
import com.schoolrecords.backend.modules.attendance.domain.UpsertOutcome;

public interface AttendanceRepositoryCustom {

    /**
     * Inserts or overwrites the row for (student, course, date) in a single
     * statement, so concurrent writers of the same key never create duplicates.
     */
    UpsertOutcome upsert(
            UUID studentId,
            UUID courseId,
            LocalDate attendanceDate,
            AttendanceStatus status,
            String remark,
            OffsetDateTime writtenAt);
}
