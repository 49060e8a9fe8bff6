package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.ErrorCode;
import com.fastalert.exception.guard.DeliveryFailedException;
import com.fastalert.model.NotificationJob;

/**
 * 渠道回报失败: 可重试则重试, 明确拒绝（如 4xx）直接放弃
 */
public class DeliveryFailedHandler implements FailureCaseHandler<DeliveryFailedException> {

    @Override
    public Class<DeliveryFailedException> exceptionType() {
        return DeliveryFailedException.class;
    }

    @Override
    public FailureDecider.Decision execute(DeliveryFailedException ex, NotificationJob job) {
        if (ex.isRetryable()) {
            return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.TRANSPORT)
                    .withCode(ErrorCode.DELIVERY_FAILED.name());
        }
        return FailureDecider.Decision.of(FailureDecider.Outcome.GIVE_UP, FailureDecider.Category.REJECTED)
                .withCode("DELIVERY_REJECTED");
    }
}
