package com.fastalert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * alert:
 *   guard:
 *     circuit-breaker:
 *       failure-threshold: 3
 *       cool-down: 30s
 *       cool-down-multiplier: 2.0
 *       max-cool-down: 10m
 *     per-channel:
 *       webhook: { failure-threshold: 5, cool-down: 10s }
 */
@Data
@ConfigurationProperties(prefix = "alert.guard")
public class AlertGuardProperties {

    /** 默认配置（可被渠道覆盖） */
    private CbConfig circuitBreaker = new CbConfig();

    /** 按渠道覆盖 */
    private Map<String, CbConfig> perChannel;

    public CbConfig configFor(String channel) {
        CbConfig c = perChannel == null ? null : perChannel.get(channel);
        return c == null ? circuitBreaker : c;
    }

    @Data
    public static class CbConfig {
        private boolean enabled = true;
        // 连续失败次数阈值
        private int failureThreshold = 3;
        // 打开后的冷却时间
        private Duration coolDown = Duration.ofSeconds(30);
        // 半开探测失败后冷却时间的放大倍数, 1.0 表示不放大
        private double coolDownMultiplier = 2.0;
        // 冷却时间上限
        private Duration maxCoolDown = Duration.ofMinutes(10);
    }
}
