package com.fastalert.core.spi;

import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;

/**
 * 通知渠道（email / sms / webhook / chat ...）
 */
public interface ChannelAdapter {

    /**
     * 渠道名, 与路由结果中的渠道对应
     */
    String channel();

    /**
     * 渠道是否配置完整, 未配置的渠道任务直接 SKIPPED
     */
    default boolean isConfigured() {
        return true;
    }

    /**
     * 发送一次, 同步方法
     * 不做内部重试, 失败以 DeliveryResult 返回; 超时由派发器控制
     */
    DeliveryResult send(NotificationJob job);
}
