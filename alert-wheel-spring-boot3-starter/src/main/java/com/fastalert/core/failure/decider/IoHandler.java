package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.model.NotificationJob;

import java.io.IOException;

/**
 * 网络 IO 异常
 */
public class IoHandler implements FailureCaseHandler<IOException> {

    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public FailureDecider.Decision execute(IOException ex, NotificationJob job) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.TRANSPORT)
                .withCode("IO_ERROR");
    }
}
