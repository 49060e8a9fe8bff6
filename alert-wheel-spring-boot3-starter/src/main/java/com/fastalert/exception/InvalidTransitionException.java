package com.fastalert.exception;

import com.fastalert.model.enums.AlertStatus;

/**
 * 生命周期动作在当前状态下不合法
 */
public class InvalidTransitionException extends AlertWheelException {

    private final String alertId;

    private final AlertStatus current;

    private final String action;

    public InvalidTransitionException(String alertId, AlertStatus current, String action) {
        super(ErrorCode.INVALID_TRANSITION,
                String.format("alert %s cannot %s from status %s", alertId, action, current));
        this.alertId = alertId;
        this.current = current;
        this.action = action;
    }

    public String getAlertId() { return alertId; }
    public AlertStatus getCurrent() { return current; }
    public String getAction() { return action; }
}
