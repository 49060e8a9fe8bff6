package com.fastalert.model.enums;

/**
 * 告警操作历史动作
 */
public enum HistoryAction {
    CREATED,
    ACKNOWLEDGED,
    RESOLVED,
    ESCALATED,
    CLOSED
}
