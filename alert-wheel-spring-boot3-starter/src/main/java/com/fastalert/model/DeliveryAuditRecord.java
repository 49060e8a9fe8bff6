package com.fastalert.model;

import com.fastalert.model.enums.JobOutcome;
import com.fastalert.model.enums.NotificationReason;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 投递审计, 挂在告警上供追溯
 */
@Value
@Builder
public class DeliveryAuditRecord {

    String alertId;

    String jobId;

    String channel;

    NotificationReason reason;

    JobOutcome status;

    int attempts;

    String providerRef;

    String errorCode;

    String error;

    Instant timestamp;
}
