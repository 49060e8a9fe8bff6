package com.fastalert.core.backoff;

import com.fastalert.config.RetryPolicy;
import com.fastalert.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class ExponentialJitterBackoffPolicy implements BackoffPolicy {

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delay(int attempt, RetryPolicy policy) {
        long base = policy.baseMillis(), min = policy.minMillis(), max = policy.maxMillis();
        double jr = policy.getJitterRatio();

        // attempt从1开始：1 -> base, 2 -> base * 2, 3 -> base * 4 ...
        double pow = Math.pow(2.0, Math.max(0, attempt - 1));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        long jittered = ideal;
        if (jr > 0) {
            jittered += Math.round(ThreadLocalRandom.current().nextDouble(-jr, jr) * ideal);
        }
        long delay = Math.max(min, Math.min(jittered, max));
        return Duration.ofMillis(Math.max(0, delay));
    }
}
