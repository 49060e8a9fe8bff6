package com.fastalert.model;

import com.fastalert.model.enums.JobOutcome;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 单个任务终态
 */
@Value
@Builder
public class JobResult {

    NotificationJob job;

    JobOutcome outcome;

    /** 实际尝试次数, 未调用渠道为 0 */
    int attempts;

    String providerRef;

    String errorCode;

    String error;

    Instant completedAt;

    public boolean isSent() {
        return outcome == JobOutcome.SENT;
    }
}
