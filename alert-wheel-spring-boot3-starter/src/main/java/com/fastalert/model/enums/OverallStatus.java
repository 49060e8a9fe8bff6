package com.fastalert.model.enums;

/**
 * 一批通知的整体投递结果
 */
public enum OverallStatus {
    /** 全部成功 */
    DELIVERED,

    /** 部分成功 */
    PARTIAL,

    /** 全部失败或为空 */
    FAILED
}
