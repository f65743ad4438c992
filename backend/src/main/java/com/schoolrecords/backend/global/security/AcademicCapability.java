package com.schoolrecords.backend.global.security;

/**
 * Permissions checked by privileged record operations. Which caller holds which
 * capability is decided outside the engine, see {@link CapabilityResolver}.
 */
public enum AcademicCapability {
    MANAGE_RECORDS,
    ENROLL_STUDENTS,
    MARK_ATTENDANCE,
    RECORD_GRADES
}
