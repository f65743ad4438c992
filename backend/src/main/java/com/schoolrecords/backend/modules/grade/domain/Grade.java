package com.schoolrecords.backend.modules.grade.domain;

import java.math.BigDecimal;
import java.util.UUID;

import com.schoolrecords.backend.global.jpa.AbstractTimestampedEntity;
import com.schoolrecords.backend.modules.enrollment.domain.Enrollment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "grade")
public class Grade extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "enrollment_id", nullable = false, updatable = false, unique = true)
    private Enrollment enrollment;

    @Column(name = "marks", nullable = false, precision = 5, scale = 2)
    private BigDecimal marks;

    @Enumerated(EnumType.STRING)
    @Column(name = "letter_grade", nullable = false, length = 2)
    private LetterGrade letterGrade;

    @Column(name = "remark", length = 500)
    private String remark;

    protected Grade() {
    }

    public Grade(Enrollment enrollment) {
        this.enrollment = enrollment;
    }

    public UUID getId() {
        return id;
    }

    public Enrollment getEnrollment() {
        return enrollment;
    }

    public BigDecimal getMarks() {
        return marks;
    }

    public LetterGrade getLetterGrade() {
        return letterGrade;
    }

    public String getRemark() {
        return remark;
    }

    /** Sets the score and re-derives the letter so the two never drift apart. */
    public void assign(BigDecimal marks, String remark) {
        this.marks = marks;
        this.letterGrade = LetterGrade.fromMarks(marks);
        this.remark = remark;
    }
}
