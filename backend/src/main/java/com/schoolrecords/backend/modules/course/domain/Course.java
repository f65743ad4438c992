package com.schoolrecords.backend.modules.course.domain;

import java.util.UUID;

import com.schoolrecords.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Catalog entry. Immutable once created, so only the constructor sets fields.
 */
@Entity
@Table(name = "course")
public class Course extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "code", nullable = false, updatable = false, length = 32)
    private String code;

    @Column(name = "name", nullable = false, updatable = false, length = 200)
    private String name;

    @Column(name = "credit_hours", nullable = false, updatable = false)
    private int creditHours;

    @Column(name = "department", nullable = false, updatable = false, length = 120)
    private String department;

    protected Course() {
    }

    public Course(String code, String name, int creditHours, String department) {
        this.code = code;
        this.name = name;
        this.creditHours = creditHours;
        this.department = department;
    }

    public UUID getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public int getCreditHours() {
        return creditHours;
    }

    public String getDepartment() {
        return department;
    }
}
