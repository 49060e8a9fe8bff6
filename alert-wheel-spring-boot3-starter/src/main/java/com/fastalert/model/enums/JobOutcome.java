package com.fastalert.model.enums;

/**
 * 通知任务终态（重试耗尽或成功后）
 */
public enum JobOutcome {
    /** 发送成功 */
    SENT,

    /** 渠道返回失败/超时, 重试耗尽或不可重试 */
    DELIVERY_FAILED,

    /** 熔断打开, 未调用渠道 */
    CHANNEL_UNAVAILABLE,

    /** 渠道未注册或未配置, 未调用渠道 */
    SKIPPED
}
