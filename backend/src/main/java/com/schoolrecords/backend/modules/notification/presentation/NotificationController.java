package com.schoolrecords.backend.modules.notification.presentation;

import java.util.List;
import java.util.Locale;

import com.schoolrecords.backend.global.error.ProblemException;
import com.schoolrecords.backend.global.security.SecurityUtils;
import com.schoolrecords.backend.modules.notification.application.NotificationService;
import com.schoolrecords.backend.modules.notification.application.NotificationService.NotificationFilterState;
import com.schoolrecords.backend.modules.notification.application.NotificationService.NotificationListResult;
import com.schoolrecords.backend.modules.notification.domain.Notification;
import com.schoolrecords.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.schoolrecords.backend.modules.notification.presentation.dto.NotificationListResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/students/{studentCode}/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @PathVariable("studentCode") String studentCode,
            @RequestParam(name = "state", defaultValue = "all") String stateParam
    ) {
        NotificationListResult result = notificationService.getNotifications(studentCode, parseState(stateParam));
        List<NotificationItemResponse> items = result.notifications().stream()
                .map(this::toItemResponse)
                .toList();
        return ResponseEntity.ok(new NotificationListResponse(items, result.unreadCount()));
    }

    @PatchMapping("/read-all")
    public ResponseEntity<Void> markAllRead(@PathVariable("studentCode") String studentCode) {
        notificationService.markAllNotificationsRead(SecurityUtils.getCurrentCapabilities(), studentCode);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clearAll(@PathVariable("studentCode") String studentCode) {
        notificationService.clearAllNotifications(SecurityUtils.getCurrentCapabilities(), studentCode);
        return ResponseEntity.noContent().build();
    }

    private NotificationItemResponse toItemResponse(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getKindCode(),
                notification.getTitle(),
                notification.getBody(),
                notification.getState().name(),
                notification.getCreatedAt(),
                notification.getReadAt()
        );
    }

    private NotificationFilterState parseState(String value) {
        String normalized = value == null ? "all" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "all" -> NotificationFilterState.ALL;
            case "unread" -> NotificationFilterState.UNREAD;
            case "read" -> NotificationFilterState.READ;
            default -> throw new ProblemException(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR",
                    "state must be all, unread or read: " + value);
        };
    }
}
