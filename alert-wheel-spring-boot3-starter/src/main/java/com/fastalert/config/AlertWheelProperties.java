package com.fastalert.config;

import com.fastalert.model.enums.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 告警管线配置（绑定前缀：alert）
 *
 * YAML 示例：
 * alert:
 *   enabled: true
 *   wheel:
 *     tick-duration: 100ms
 *     ticks-per-wheel: 512
 *     max-pending-timeouts: 100000
 *   dispatch:
 *     batch-size: 500
 *     concurrency: 32
 *     send-timeout: 10s
 *   escalation:
 *     enabled: true
 *     delays:
 *       CRITICAL: 15m
 *       HIGH: 30m
 *       MEDIUM: 1h
 *       LOW: 4h
 *     executor:
 *       core-pool-size: 2
 *       max-pool-size: 4
 *       queue-capacity: 1000
 *   retry:
 *     max-attempts: 3
 *     strategy: sequence
 *     delays: [5s, 15s, 60s]
 *     per-channel:
 *       sms: { max-attempts: 5, strategy: exponential, base: 2s }
 *   retention:
 *     enabled: true
 *     resolved-retention: 7d
 *     archive-after: 30d
 *     sweep-period: 1h
 *   shutdown:
 *     await: 30s
 */
@Validated
@ConfigurationProperties(prefix = "alert")
public class AlertWheelProperties {

    /** 是否启动升级恢复与保留期清理 */
    private boolean enabled = true;

    private Wheel wheel = new Wheel();

    private Dispatch dispatch = new Dispatch();

    private Escalation escalation = new Escalation();

    private Retry retry = new Retry();

    private Retention retention = new Retention();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Wheel {
        /** 时间轮刻度（Duration 友好写法：100ms、1s） */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        /** 允许挂起的最大 timeout 数量（Netty 参数） */
        private long maxPendingTimeouts = 100_000;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }
        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
        public long getMaxPendingTimeouts() { return maxPendingTimeouts; }
        public void setMaxPendingTimeouts(long maxPendingTimeouts) { this.maxPendingTimeouts = maxPendingTimeouts; }
    }

    public static class Dispatch {
        /** 每批任务数 */
        private int batchSize = 500;

        /** 并发上限（worker 线程数） */
        private int concurrency = 32;

        /** 单次渠道调用超时, 超时按发送失败计 */
        private Duration sendTimeout = Duration.ofSeconds(10);

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }
        public Duration getSendTimeout() { return sendTimeout; }
        public void setSendTimeout(Duration sendTimeout) { this.sendTimeout = sendTimeout; }
    }

    public static class Escalation {
        private boolean enabled = true;

        /** 各级别首次升级延迟 */
        private Map<Severity, Duration> delays = defaultDelays();

        /** 触发后执行升级的线程池 */
        private Exec executor = new Exec();

        private static Map<Severity, Duration> defaultDelays() {
            Map<Severity, Duration> m = new EnumMap<>(Severity.class);
            m.put(Severity.CRITICAL, Duration.ofMinutes(15));
            m.put(Severity.HIGH, Duration.ofMinutes(30));
            m.put(Severity.MEDIUM, Duration.ofHours(1));
            m.put(Severity.LOW, Duration.ofHours(4));
            return m;
        }

        /** 未配置的级别按 1h */
        public Duration delayFor(Severity severity) {
            return delays.getOrDefault(severity, Duration.ofHours(1));
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Map<Severity, Duration> getDelays() { return delays; }
        public void setDelays(Map<Severity, Duration> delays) { this.delays = delays; }
        public Exec getExecutor() { return executor; }
        public void setExecutor(Exec executor) { this.executor = executor; }
    }

    public static class Exec {
        private int corePoolSize = 2;

        private int maxPoolSize = 4;

        /** 任务队列容量 */
        private int queueCapacity = 1000;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.CALLER_RUNS;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }
        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Retry extends RetryPolicy {
        /** 按渠道覆盖, 整体替换默认策略 */
        private Map<String, RetryPolicy> perChannel = new HashMap<>();

        public RetryPolicy policyFor(String channel) {
            RetryPolicy p = perChannel == null ? null : perChannel.get(channel);
            return p == null ? this : p;
        }

        public Map<String, RetryPolicy> getPerChannel() { return perChannel; }
        public void setPerChannel(Map<String, RetryPolicy> perChannel) { this.perChannel = perChannel; }
    }

    public static class Retention {
        private boolean enabled = true;

        /** RESOLVED 多久后关闭 */
        private Duration resolvedRetention = Duration.ofDays(7);

        /** CLOSED 多久后清除 */
        private Duration archiveAfter = Duration.ofDays(30);

        /** 扫描周期 */
        private Duration sweepPeriod = Duration.ofHours(1);

        /** 首次扫描延迟 */
        private Duration initialDelay = Duration.ofMinutes(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getResolvedRetention() { return resolvedRetention; }
        public void setResolvedRetention(Duration resolvedRetention) { this.resolvedRetention = resolvedRetention; }
        public Duration getArchiveAfter() { return archiveAfter; }
        public void setArchiveAfter(Duration archiveAfter) { this.archiveAfter = archiveAfter; }
        public Duration getSweepPeriod() { return sweepPeriod; }
        public void setSweepPeriod(Duration sweepPeriod) { this.sweepPeriod = sweepPeriod; }
        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
    }

    public static class Shutdown {
        /** 优雅停机等待时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    // ----------------- 公共枚举/工具 -----------------

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public static RejectedHandlerPolicy from(String v) {
            return RejectedHandlerPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT));
        }
        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }

    public Escalation getEscalation() { return escalation; }
    public void setEscalation(Escalation escalation) { this.escalation = escalation; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Retention getRetention() { return retention; }
    public void setRetention(Retention retention) { this.retention = retention; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 便捷换算 -----------------

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }

    /** 单次发送超时毫秒 */
    public long sendTimeoutMillis() { return dispatch.getSendTimeout().toMillis(); }
}
