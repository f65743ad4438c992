package com.schoolrecords.backend.modules.notification.domain;

public enum NotificationState {
    UNREAD,
    READ
}
