package com.fastalert.model;

import com.fastalert.model.enums.DeliveryStatus;
import lombok.Value;

/**
 * 渠道返回值
 */
@Value
public class DeliveryResult {

    DeliveryStatus status;

    /** 服务商回执号 */
    String providerRef;

    String error;

    /** 失败时是否值得重试（4xx 等明确拒绝为 false） */
    boolean retryable;

    public static DeliveryResult sent(String providerRef) {
        return new DeliveryResult(DeliveryStatus.SENT, providerRef, null, false);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(DeliveryStatus.FAILED, null, error, true);
    }

    public static DeliveryResult rejected(String error) {
        return new DeliveryResult(DeliveryStatus.FAILED, null, error, false);
    }

    public boolean isSent() {
        return status == DeliveryStatus.SENT;
    }
}
