package com.schoolrecords.backend.modules.course.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.schoolrecords.backend.modules.course.domain.Course;

public interface CourseRepository extends JpaRepository<Course, UUID> {

    Optional<Course> findByCode(String code);

    boolean existsByCode(String code);

    List<Course> findAllByOrderByCodeAsc();

    List<Course> findByDepartmentOrderByCodeAsc(String department);
}
