package com.schoolrecords.backend.modules.attendance.domain;

public enum UpsertOutcome {
    INSERTED,
    UPDATED
}
