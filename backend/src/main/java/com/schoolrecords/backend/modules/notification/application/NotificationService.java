package com.schoolrecords.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.schoolrecords.backend.global.error.ProblemException;
import com.schoolrecords.backend.global.security.AcademicCapability;
import com.schoolrecords.backend.global.security.Capabilities;
import com.schoolrecords.backend.modules.notification.domain.Notification;
import com.schoolrecords.backend.modules.notification.domain.NotificationState;
import com.schoolrecords.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;

@Service
@Transactional
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    public static final String KIND_GRADE_POSTED = "GRADE_POSTED";

    private final NotificationRepository notificationRepository;
    private final StudentRepository studentRepository;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            StudentRepository studentRepository,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.studentRepository = studentRepository;
        this.clock = clock;
    }

    /**
     * Creates a notification for the student with the given code. An unknown
     * recipient is not an error: the notification is dropped and a warning is
     * logged.
     */
    public Optional<Notification> sendNotification(String studentCode, String kindCode, String title, String body) {
        Optional<Student> student = studentRepository.findByStudentCode(studentCode);
        if (student.isEmpty()) {
            log.warn("Dropping {} notification for unknown student {}", kindCode, studentCode);
            return Optional.empty();
        }
        return Optional.of(notifyStudent(student.get(), kindCode, title, body));
    }

    public Notification notifyStudent(Student student, String kindCode, String title, String body) {
        Notification notification = new Notification();
        notification.setStudent(student);
        notification.setKindCode(kindCode);
        notification.setTitle(title);
        notification.setBody(body);
        return notificationRepository.save(notification);
    }

    @Transactional(readOnly = true)
    public NotificationListResult getNotifications(String studentCode, NotificationFilterState filter) {
        Student student = loadStudent(studentCode);
        List<Notification> notifications = switch (filter) {
            case ALL -> notificationRepository.findByStudentIdOrderByCreatedAtDesc(student.getId());
            case UNREAD -> notificationRepository.findByStudentIdAndStateOrderByCreatedAtDesc(
                    student.getId(), NotificationState.UNREAD);
            case READ -> notificationRepository.findByStudentIdAndStateOrderByCreatedAtDesc(
                    student.getId(), NotificationState.READ);
        };
        long unreadCount = notificationRepository.countByStudentIdAndState(student.getId(), NotificationState.UNREAD);
        return new NotificationListResult(notifications, unreadCount);
    }

    public int markAllNotificationsRead(Capabilities capabilities, String studentCode) {
        capabilities.require(AcademicCapability.MANAGE_RECORDS);
        Student student = loadStudent(studentCode);
        List<Notification> unread = notificationRepository.findByStudentIdAndStateOrderByCreatedAtDesc(
                student.getId(), NotificationState.UNREAD);
        if (unread.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        unread.forEach(notification -> notification.markRead(now));
        notificationRepository.saveAll(unread);
        return unread.size();
    }

    public int clearAllNotifications(Capabilities capabilities, String studentCode) {
        capabilities.require(AcademicCapability.MANAGE_RECORDS);
        Student student = loadStudent(studentCode);
        return notificationRepository.deleteByStudentId(student.getId());
    }

    private Student loadStudent(String studentCode) {
        return studentRepository.findByStudentCode(studentCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "STUDENT_NOT_FOUND",
                        "student " + studentCode + " does not exist"));
    }

    public enum NotificationFilterState {
        ALL,
        UNREAD,
        READ
    }

    public record NotificationListResult(List<Notification> notifications, long unreadCount) {
    }
}
