package com.fastalert.exception;

public class AlertNotFoundException extends AlertWheelException {

    public AlertNotFoundException(String alertId) {
        super(ErrorCode.NOT_FOUND, "alert not found: " + alertId);
    }
}
