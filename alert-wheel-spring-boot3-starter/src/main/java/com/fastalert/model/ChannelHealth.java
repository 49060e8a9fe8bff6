package com.fastalert.model;

import com.fastalert.model.enums.CircuitState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 渠道健康快照
 */
@Value
@Builder
public class ChannelHealth {

    String channel;

    CircuitState state;

    /** 当前窗口内失败次数 */
    int failureCount;

    /** 最近一次打开时间, 非 OPEN 时为 null */
    Instant openedAt;
}
