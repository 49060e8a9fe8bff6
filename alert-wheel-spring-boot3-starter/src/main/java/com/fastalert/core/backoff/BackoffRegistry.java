package com.fastalert.core.backoff;

import com.fastalert.config.AlertWheelProperties;
import com.fastalert.config.RetryPolicy;
import com.fastalert.core.spi.BackoffPolicy;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 sequence / fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 按渠道取生效的 RetryPolicy
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "sequence";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final AlertWheelProperties props;

    public BackoffRegistry(AlertWheelProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("sequence", new SequenceBackoffPolicy());
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent("exponential", new ExponentialJitterBackoffPolicy());
    }

    public BackoffRegistry(AlertWheelProperties props) {
        this(props, null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀, 未知名称回落到 sequence
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /** 渠道生效的重试配置 */
    public RetryPolicy policyFor(String channel) {
        return props.getRetry().policyFor(channel);
    }

    /**
     * 计算某渠道第 attempt 次失败后的等待时间
     */
    public Duration delay(String channel, int attempt) {
        RetryPolicy policy = policyFor(channel);
        return resolve(policy.getStrategy()).delay(attempt, policy);
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        check("alert.retry", props.getRetry());
        if (props.getRetry().getPerChannel() != null) {
            props.getRetry().getPerChannel().forEach((ch, p) -> check("alert.retry.per-channel." + ch, p));
        }
    }

    private static void check(String prefix, RetryPolicy p) {
        if (p.maxMillis() < p.minMillis()) {
            throw new IllegalArgumentException(prefix + ".max must be >= " + prefix + ".min");
        }
        if (p.getMaxAttempts() < 1) {
            throw new IllegalArgumentException(prefix + ".max-attempts must be >= 1");
        }
    }
}
