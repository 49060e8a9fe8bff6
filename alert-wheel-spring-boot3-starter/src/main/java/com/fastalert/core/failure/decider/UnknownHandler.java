package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.ErrorCode;
import com.fastalert.model.NotificationJob;

/**
 * 未知异常, 兜底按可重试处理
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {

    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public FailureDecider.Decision execute(Throwable ex, NotificationJob job) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.UNKNOWN)
                .withCode(ErrorCode.DELIVERY_FAILED.name());
    }
}
