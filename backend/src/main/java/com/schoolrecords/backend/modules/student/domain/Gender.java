package com.schoolrecords.backend.modules.student.domain;

public enum Gender {
    MALE,
    FEMALE,
    OTHER
}
