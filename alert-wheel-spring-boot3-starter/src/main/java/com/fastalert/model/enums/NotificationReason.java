package com.fastalert.model.enums;

/**
 * 触发通知的生命周期事件
 */
public enum NotificationReason {
    CREATED,
    ESCALATED,
    ACKNOWLEDGED,
    RESOLVED
}
