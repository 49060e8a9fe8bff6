package com.fastalert.exception;

/**
 * 错误码
 */
public enum ErrorCode {
    /** 告警/计划不存在 */
    NOT_FOUND,

    /** 当前状态不允许该操作 */
    INVALID_TRANSITION,

    /** 渠道熔断打开 */
    CHANNEL_UNAVAILABLE,

    /** 渠道发送失败 */
    DELIVERY_FAILED,

    /** 升级计划重复, 内部不变量被破坏 */
    DUPLICATE_SCHEDULE,

    /** 渠道未注册或未配置 */
    CHANNEL_NOT_CONFIGURED
}
