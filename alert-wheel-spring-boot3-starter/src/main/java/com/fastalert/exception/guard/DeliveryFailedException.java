package com.fastalert.exception.guard;

import com.fastalert.exception.AlertWheelException;
import com.fastalert.exception.ErrorCode;

/**
 * 渠道回报的发送失败
 */
public class DeliveryFailedException extends AlertWheelException {

    private final String channel;

    private final boolean retryable;

    public DeliveryFailedException(String channel, String message, boolean retryable) {
        super(ErrorCode.DELIVERY_FAILED, "[" + channel + "] " + message);
        this.channel = channel;
        this.retryable = retryable;
    }

    public String getChannel() { return channel; }
    public boolean isRetryable() { return retryable; }
}
