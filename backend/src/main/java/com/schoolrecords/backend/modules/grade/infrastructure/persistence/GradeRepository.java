package com.schoolrecords.backend.modules.grade.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.schoolrecords.backend.modules.grade.domain.Grade;

public interface GradeRepository extends JpaRepository<Grade, UUID> {

    Optional<Grade> findByEnrollmentId(UUID enrollmentId);

    List<Grade> findByEnrollmentIdIn(Collection<UUID> enrollmentIds);

    @Modifying
    @Query("delete from Grade g where g.enrollment.id in :enrollmentIds")
    int deleteByEnrollmentIds(@Param("enrollmentIds") Collection<UUID> enrollmentIds);
}
