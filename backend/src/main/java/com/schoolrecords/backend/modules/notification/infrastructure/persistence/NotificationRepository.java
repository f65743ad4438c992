package com.schoolrecords.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.schoolrecords.backend.modules.notification.domain.Notification;
import com.schoolrecords.backend.modules.notification.domain.NotificationState;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    List<Notification> findByStudentIdOrderByCreatedAtDesc(UUID studentId);

    List<Notification> findByStudentIdAndStateOrderByCreatedAtDesc(UUID studentId, NotificationState state);

    long countByStudentIdAndState(UUID studentId, NotificationState state);

    @Modifying
    @Query("delete from Notification n where n.student.id = :studentId")
    int deleteByStudentId(@Param("studentId") UUID studentId);
}
