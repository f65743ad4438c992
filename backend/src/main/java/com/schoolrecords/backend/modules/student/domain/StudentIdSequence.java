package com.schoolrecords.backend.modules.student.domain;

import com.schoolrecords.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One row per enrollment year. Allocation locks this row for update, which
 * serializes every id assignment of the same year.
 */
@Entity
@Table(name = "student_id_sequence")
public class StudentIdSequence extends AbstractTimestampedEntity {

    @Id
    @Column(name = "enrollment_year", nullable = false)
    private int enrollmentYear;

    /** Last sequence number handed out for the year. */
    @Column(name = "last_number", nullable = false)
    private int lastNumber;

    protected StudentIdSequence() {
    }

    public int getEnrollmentYear() {
        return enrollmentYear;
    }

    public int getLastNumber() {
        return lastNumber;
    }

    public void setLastNumber(int lastNumber) {
        this.lastNumber = lastNumber;
    }
}
