package com.fastalert.exception;

/**
 * 同一 (alertId, level) 出现第二条 PENDING 计划
 * 只由存储层抛出, upsert 路径不会触发
 */
public class DuplicateScheduleException extends AlertWheelException {

    public DuplicateScheduleException(String alertId, int level) {
        super(ErrorCode.DUPLICATE_SCHEDULE,
                String.format("pending escalation already exists for alert %s level %d", alertId, level));
    }
}
