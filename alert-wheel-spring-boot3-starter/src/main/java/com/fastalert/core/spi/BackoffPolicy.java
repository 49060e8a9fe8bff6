package com.fastalert.core.spi;

import com.fastalert.config.RetryPolicy;

import java.time.Duration;

/**
 * 回退策略（计算下一次投递前的等待时间）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "sequence"、"fixed"、"exponential"） */
    String name();

    /**
     * @param attempt 刚失败的是第几次尝试, 从1开始
     * @param policy  渠道生效的重试配置（delays/base/min/max/jitterRatio）
     * @return 等待时长, 已按 min/max 截断
     */
    Duration delay(int attempt, RetryPolicy policy);
}
