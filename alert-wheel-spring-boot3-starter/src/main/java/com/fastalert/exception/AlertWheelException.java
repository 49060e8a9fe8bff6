package com.fastalert.exception;

/**
 * 基类, 携带错误码
 */
public class AlertWheelException extends RuntimeException {

    private final ErrorCode code;

    public AlertWheelException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AlertWheelException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
