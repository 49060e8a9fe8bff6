package com.fastalert.model;

import com.fastalert.model.enums.NotificationReason;
import com.fastalert.model.enums.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * 一次派发单元, 不落库
 */
@Value
@Builder(toBuilder = true)
public class NotificationJob {

    String jobId;

    String alertId;

    String channel;

    RenderedPayload payload;

    /** 当前第几次尝试, 从1开始 */
    int attempt;

    int maxAttempts;

    NotificationReason reason;

    /** 发送时告警级别, 供渠道决定格式 */
    Severity severity;

    public NotificationJob nextAttempt() {
        return toBuilder().attempt(attempt + 1).build();
    }

    public boolean hasAttemptsLeft() {
        return attempt < maxAttempts;
    }
}
