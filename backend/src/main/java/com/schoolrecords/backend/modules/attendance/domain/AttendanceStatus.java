package com.schoolrecords.backend.modules.attendance.domain;

public enum AttendanceStatus {
    PRESENT,
    ABSENT,
    LATE,
    EXCUSED
}
