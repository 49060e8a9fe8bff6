package com.fastalert.exception.guard;

import com.fastalert.exception.AlertWheelException;
import com.fastalert.exception.ErrorCode;

/**
 * 渠道熔断打开, 快速失败
 * 用于 FailureDecider 识别 系统性故障
 */
public class ChannelUnavailableException extends AlertWheelException {

    private final String channel;

    public ChannelUnavailableException(String channel, Throwable cause) {
        super(ErrorCode.CHANNEL_UNAVAILABLE, "channel circuit open: " + channel, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
