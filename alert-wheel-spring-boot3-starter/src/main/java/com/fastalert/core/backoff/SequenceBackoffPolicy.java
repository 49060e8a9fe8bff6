package com.fastalert.core.backoff;

import com.fastalert.config.RetryPolicy;
import com.fastalert.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.List;

/**
 * 按配置序列取间隔（默认 5s, 15s, 60s）, 超出序列后沿用最后一个
 */
public class SequenceBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "sequence";
    }

    @Override
    public Duration delay(int attempt, RetryPolicy policy) {
        List<Duration> delays = policy.getDelays();
        long delay = policy.baseMillis();
        if (delays != null && !delays.isEmpty()) {
            int idx = Math.min(Math.max(attempt, 1), delays.size()) - 1;
            delay = delays.get(idx).toMillis();
        }
        delay = Math.max(policy.minMillis(), Math.min(delay, policy.maxMillis()));
        return Duration.ofMillis(Math.max(0, delay));
    }
}
