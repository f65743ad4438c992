package com.schoolrecords.backend.modules.enrollment.domain;

import java.util.UUID;

import com.schoolrecords.backend.global.jpa.AbstractTimestampedEntity;
import com.schoolrecords.backend.modules.course.domain.Course;
import com.schoolrecords.backend.modules.student.domain.Student;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(
        name = "enrollment",
        uniqueConstraints = @UniqueConstraint(
                name = Enrollment.UNIQUE_TERM_CONSTRAINT,
                columnNames = {"student_id", "course_id", "semester", "academic_year"}
        )
)
public class Enrollment extends AbstractTimestampedEntity {

    public static final String UNIQUE_TERM_CONSTRAINT = "uq_enrollment_student_course_term";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private Student student;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "course_id", nullable = false, updatable = false)
    private Course course;

    @Column(name = "semester", nullable = false, updatable = false, length = 32)
    private String semester;

    @Column(name = "academic_year", nullable = false, updatable = false, length = 16)
    private String academicYear;

    protected Enrollment() {
    }

    public Enrollment(Student student, Course course, String semester, String academicYear) {
        this.student = student;
        this.course = course;
        this.semester = semester;
        this.academicYear = academicYear;
    }

    public UUID getId() {
        return id;
    }

    public Student getStudent() {
        return student;
    }

    public Course getCourse() {
        return course;
    }

    public String getSemester() {
        return semester;
    }

    public String getAcademicYear() {
        return academicYear;
    }
}
