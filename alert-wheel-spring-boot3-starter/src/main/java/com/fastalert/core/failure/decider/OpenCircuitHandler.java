package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.ErrorCode;
import com.fastalert.exception.guard.ChannelUnavailableException;
import com.fastalert.model.NotificationJob;

/**
 * 熔断打开, 不再重试, 单独记 CHANNEL_UNAVAILABLE
 */
public class OpenCircuitHandler implements FailureCaseHandler<ChannelUnavailableException> {

    @Override
    public Class<ChannelUnavailableException> exceptionType() {
        return ChannelUnavailableException.class;
    }

    @Override
    public FailureDecider.Decision execute(ChannelUnavailableException ex, NotificationJob job) {
        return FailureDecider.Decision
                .of(FailureDecider.Outcome.GIVE_UP, FailureDecider.Category.OPEN_CIRCUIT)
                .withCode(ErrorCode.CHANNEL_UNAVAILABLE.name());
    }
}
