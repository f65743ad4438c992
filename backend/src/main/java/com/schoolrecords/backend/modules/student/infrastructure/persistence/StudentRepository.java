package com.schoolrecords.backend.modules.student.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.schoolrecords.backend.modules.student.domain.Student;

public interface StudentRepository extends JpaRepository<Student, UUID> {

    Optional<Student> findByStudentCode(String studentCode);

    List<Student> findAllByOrderByStudentCodeAsc();

    @Query("select s.studentCode from Student s where s.studentCode like concat(:prefix, '%')")
    List<String> findStudentCodesByPrefix(@Param("prefix") String prefix);
}
