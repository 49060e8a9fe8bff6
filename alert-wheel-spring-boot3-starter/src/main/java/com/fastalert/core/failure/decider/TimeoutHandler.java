package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.model.NotificationJob;

import java.util.concurrent.TimeoutException;

/**
 * 超时处理, 与传输失败同等重试, 间隔略放大
 */
public class TimeoutHandler implements FailureCaseHandler<TimeoutException> {

    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public FailureDecider.Decision execute(TimeoutException ex, NotificationJob job) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.TIMEOUT)
                .factor(1.5).withCode("TIMEOUT");
    }
}
