package com.fastalert.core.backoff;

import com.fastalert.config.RetryPolicy;
import com.fastalert.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration delay(int attempt, RetryPolicy policy) {
        long delay = policy.baseMillis();
        double jr = policy.getJitterRatio();
        if (jr > 0) {
            delay += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * delay);
        }
        delay = Math.max(policy.minMillis(), Math.min(delay, policy.maxMillis()));
        return Duration.ofMillis(Math.max(0, delay));
    }
}
