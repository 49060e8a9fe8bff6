package com.fastalert.core.guard;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.exception.guard.ChannelUnavailableException;
import com.fastalert.model.ChannelHealth;
import com.fastalert.model.enums.CircuitState;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 渠道熔断
 * 每个渠道一个 CircuitBreaker, 所有派发 worker 共享
 * 连续 N 次失败打开; 冷却后半开放行 1 次探测; 探测失败重新打开并按倍数放大冷却时间
 */
public class ChannelHealthTracker {

    private static final Logger log = LoggerFactory.getLogger(ChannelHealthTracker.class);

    private final AlertGuardProperties props;

    private final AlertMetrics metrics;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();

    /** 最近一次打开时间 */
    private final ConcurrentHashMap<String, Instant> openedAt = new ConcurrentHashMap<>();

    /** 连续失败次数, 成功或回到 CLOSED 时清零 */
    private final ConcurrentHashMap<String, AtomicInteger> consecutiveFailures = new ConcurrentHashMap<>();

    public ChannelHealthTracker(AlertGuardProperties props, AlertMetrics metrics) {
        this.props = props;
        this.metrics = metrics;
    }

    /**
     * 申请一次调用许可, 熔断打开或半开名额已用完时快速失败
     */
    public void acquire(String channel) {
        CircuitBreaker cb = getCircuitBreakerIfEnabled(channel);
        if (cb == null) {
            return;
        }
        try {
            cb.acquirePermission();
        } catch (CallNotPermittedException open) {
            throw new ChannelUnavailableException(channel, open);
        }
    }

    public void onSuccess(String channel, long durationNanos) {
        failures(channel).set(0);
        CircuitBreaker cb = getCircuitBreakerIfEnabled(channel);
        if (cb != null) {
            cb.onSuccess(durationNanos, TimeUnit.NANOSECONDS);
        }
    }

    public void onFailure(String channel, long durationNanos, Throwable cause) {
        failures(channel).incrementAndGet();
        CircuitBreaker cb = getCircuitBreakerIfEnabled(channel);
        if (cb != null) {
            cb.onError(durationNanos, TimeUnit.NANOSECONDS, cause);
        }
    }

    /**
     * 许可已拿到但调用未发生, 归还许可, 不计成功或失败
     */
    public void release(String channel) {
        CircuitBreaker cb = getCircuitBreakerIfEnabled(channel);
        if (cb != null) {
            cb.releasePermission();
        }
    }

    public ChannelHealth health(String channel) {
        CircuitBreaker cb = getCircuitBreakerIfEnabled(channel);
        if (cb == null) {
            return ChannelHealth.builder().channel(channel).state(CircuitState.CLOSED)
                    .failureCount(failures(channel).get()).build();
        }
        CircuitState state = CircuitState.from(cb.getState());
        return ChannelHealth.builder()
                .channel(channel)
                .state(state)
                .failureCount(failures(channel).get())
                .openedAt(state == CircuitState.OPEN ? openedAt.get(channel) : null)
                .build();
    }

    /** 已出现过的渠道 */
    public List<ChannelHealth> snapshot() {
        return cbCache.keySet().stream()
                .sorted(Comparator.naturalOrder())
                .map(this::health)
                .toList();
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String channel) {
        if (!props.configFor(channel).isEnabled()) {
            return null;
        }
        return cbCache.computeIfAbsent(channel, this::buildCb);
    }

    private AtomicInteger failures(String channel) {
        return consecutiveFailures.computeIfAbsent(channel, k -> new AtomicInteger());
    }

    private CircuitBreaker buildCb(String channel) {
        AlertGuardProperties.CbConfig c = props.configFor(channel);
        int threshold = Math.max(1, c.getFailureThreshold());
        long coolMs = Math.max(1, c.getCoolDown().toMillis());
        long maxCoolMs = Math.max(coolMs, c.getMaxCoolDown().toMillis());

        IntervalFunction wait = c.getCoolDownMultiplier() > 1.0
                ? IntervalFunction.ofExponentialBackoff(coolMs, c.getCoolDownMultiplier(), maxCoolMs)
                : IntervalFunction.of(coolMs);

        // 窗口 = 阈值 且 失败率 100%, 等价于连续 N 次失败
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100.0f)
                .waitIntervalFunctionInOpenState(wait)
                .permittedNumberOfCallsInHalfOpenState(1)
                .recordExceptions(Throwable.class)
                .build();
        CircuitBreaker cb = CircuitBreaker.of("cb:" + channel, cfg);
        cb.getEventPublisher().onStateTransition(e -> {
            CircuitBreaker.State to = e.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                openedAt.put(channel, e.getCreationTime().toInstant());
                log.warn("[Guard] channel={} circuit {}", channel, e.getStateTransition());
            } else {
                if (to == CircuitBreaker.State.CLOSED) {
                    failures(channel).set(0);
                }
                log.info("[Guard] channel={} circuit {}", channel, e.getStateTransition());
            }
            metrics.incTransition(channel, to.name());
        });
        return cb;
    }
}
