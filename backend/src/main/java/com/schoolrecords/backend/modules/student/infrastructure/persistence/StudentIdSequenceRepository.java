package com.schoolrecords.backend.modules.student.infrastructure.persistence;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.schoolrecords.backend.modules.student.domain.StudentIdSequence;

public interface StudentIdSequenceRepository extends JpaRepository<StudentIdSequence, Integer> {

    @Modifying
    @Query(value = """
            insert into student_id_sequence (enrollment_year, last_number, created_at, updated_at)
            values (:year, 0, current_timestamp, current_timestamp)
            on conflict (enrollment_year) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("year") int year);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from StudentIdSequence s where s.enrollmentYear = :year")
    Optional<StudentIdSequence> findByYearForUpdate(@Param("year") int year);
}
