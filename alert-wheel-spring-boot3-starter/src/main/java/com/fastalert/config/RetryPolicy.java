package com.fastalert.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 投递重试策略, 可按渠道覆盖
 */
public class RetryPolicy {

    /** 最大尝试次数（含首次） */
    private int maxAttempts = 3;

    /** 策略：sequence | fixed | exponential | spi:{name} */
    private String strategy = "sequence";

    /** sequence 策略的间隔序列, 超出后沿用最后一个 */
    private List<Duration> delays = new ArrayList<>(List.of(
            Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofSeconds(60)));

    /** 基础间隔（fixed/exponential） */
    private Duration base = Duration.ofSeconds(1);

    /** 最小间隔 */
    private Duration min = Duration.ofMillis(500);

    /** 最大间隔 */
    private Duration max = Duration.ofSeconds(300);

    /** 抖动比例（0~1），例如 0.2 表示 ±20% */
    private double jitterRatio = 0.2;

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }
    public List<Duration> getDelays() { return delays; }
    public void setDelays(List<Duration> delays) { this.delays = delays; }
    public Duration getBase() { return base; }
    public void setBase(Duration base) { this.base = base; }
    public Duration getMin() { return min; }
    public void setMin(Duration min) { this.min = min; }
    public Duration getMax() { return max; }
    public void setMax(Duration max) { this.max = max; }
    public double getJitterRatio() { return jitterRatio; }
    public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }

    public long baseMillis() { return base.toMillis(); }
    public long minMillis() { return min.toMillis(); }
    public long maxMillis() { return max.toMillis(); }
}
