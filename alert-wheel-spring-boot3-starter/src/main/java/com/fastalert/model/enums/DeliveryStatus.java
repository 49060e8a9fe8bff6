package com.fastalert.model.enums;

/**
 * 渠道单次发送结果
 */
public enum DeliveryStatus {
    SENT,
    FAILED
}
