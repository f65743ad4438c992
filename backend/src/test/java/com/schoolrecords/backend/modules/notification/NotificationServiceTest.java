package com.schoolrecords.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.schoolrecords.backend.global.error.ProblemException;
import com.schoolrecords.backend.global.security.AcademicCapability;
import com.schoolrecords.backend.global.security.Capabilities;
import com.schoolrecords.backend.modules.notification.application.NotificationService;
import com.schoolrecords.backend.modules.notification.application.NotificationService.NotificationFilterState;
import com.schoolrecords.backend.modules.notification.application.NotificationService.NotificationListResult;
import com.schoolrecords.backend.modules.notification.domain.Notification;
import com.schoolrecords.backend.modules.notification.domain.NotificationState;
import com.schoolrecords.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.schoolrecords.backend.modules.student.domain.Student;
import com.schoolrecords.backend.modules.student.infrastructure.persistence.StudentRepository;
import com.schoolrecords.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private StudentRepository studentRepository;

    private NotificationService notificationService;
    private Clock clock;
    private Student student;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(OffsetDateTime.parse("2025-01-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        notificationService = new NotificationService(notificationRepository, studentRepository, clock);
        student = TestEntities.student("STU20240001");
    }

    @Test
    @DisplayName("a notification for a known student is stored unread")
    void sendsNotification() {
        when(studentRepository.findByStudentCode("STU20240001")).thenReturn(Optional.of(student));
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Optional<Notification> sent = notificationService.sendNotification(
                "STU20240001", NotificationService.KIND_GRADE_POSTED, "Grade posted for MTH101", "MTH101 Calculus (Fall 2024-2025): 91.00 (A)");

        assertThat(sent).isPresent();
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        assertThat(captor.getValue().getStudent()).isSameAs(student);
        assertThat(captor.getValue().getState()).isEqualTo(NotificationState.UNREAD);
    }

    @Test
    @DisplayName("a notification for an unknown student is dropped without failing")
    void dropsNotificationForUnknownStudent() {
        when(studentRepository.findByStudentCode("STU20249999")).thenReturn(Optional.empty());

        Optional<Notification> sent = notificationService.sendNotification(
                "STU20249999", NotificationService.KIND_GRADE_POSTED, "Grade posted for MTH101", "MTH101 Calculus (Fall 2024-2025): 91.00 (A)");

        assertThat(sent).isEmpty();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    @DisplayName("listing returns the unread count alongside the items")
    void listsWithUnreadCount() {
        Notification first = notification("first");
        when(studentRepository.findByStudentCode("STU20240001")).thenReturn(Optional.of(student));
        when(notificationRepository.findByStudentIdOrderByCreatedAtDesc(student.getId())).thenReturn(List.of(first));
        when(notificationRepository.countByStudentIdAndState(student.getId(), NotificationState.UNREAD)).thenReturn(1L);

        NotificationListResult result = notificationService.getNotifications("STU20240001", NotificationFilterState.ALL);

        assertThat(result.notifications()).containsExactly(first);
        assertThat(result.unreadCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("mark all read stamps every unread notification with the clock")
    void marksAllRead() {
        Notification first = notification("first");
        Notification second = notification("second");
        when(studentRepository.findByStudentCode("STU20240001")).thenReturn(Optional.of(student));
        when(notificationRepository.findByStudentIdAndStateOrderByCreatedAtDesc(student.getId(), NotificationState.UNREAD))
                .thenReturn(List.of(first, second));

        int updated = notificationService.markAllNotificationsRead(Capabilities.all(), "STU20240001");

        assertThat(updated).isEqualTo(2);
        assertThat(first.getState()).isEqualTo(NotificationState.READ);
        assertThat(second.getReadAt()).isEqualTo(OffsetDateTime.now(clock));
    }

    @Test
    @DisplayName("clearing notifications of an unknown student is STUDENT_NOT_FOUND")
    void clearUnknownStudent() {
        when(studentRepository.findByStudentCode("STU20249999")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> notificationService.clearAllNotifications(Capabilities.all(), "STU20249999"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("STUDENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("marking read and clearing need MANAGE_RECORDS and touch no store without it")
    void mutationsRequireManageRecords() {
        Capabilities teacher = Capabilities.of(AcademicCapability.MARK_ATTENDANCE, AcademicCapability.RECORD_GRADES);

        assertThatThrownBy(() -> notificationService.markAllNotificationsRead(teacher, "STU20240001"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("CAPABILITY_REQUIRED"));
        assertThatThrownBy(() -> notificationService.clearAllNotifications(Capabilities.none(), "STU20240001"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("CAPABILITY_REQUIRED"));

        verifyNoInteractions(studentRepository, notificationRepository);
    }

    private Notification notification(String title) {
        Notification notification = new Notification();
        notification.setStudent(student);
        notification.setKindCode(NotificationService.KIND_GRADE_POSTED);
        notification.setTitle(title);
        notification.setBody(title);
        return notification;
    }
}
