package com.fastalert.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class AlertMetrics {
    private final MeterRegistry reg;
    private final Counter admitted;
    private final Counter deduplicated;
    private final Counter escalated;
    private final Counter sent;
    private final Counter failed;
    private final Counter unavailable;
    private final Counter skipped;
    private final Counter closed;
    private final Counter purged;
    private final DistributionSummary attempts;
    private final Timer sendTimer;

    private AlertMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.admitted     = Counter.builder("alert.admitted").description("new alerts created").register(reg);
        this.deduplicated = Counter.builder("alert.deduplicated").description("duplicate facts merged").register(reg);
        this.escalated    = Counter.builder("alert.escalated").description("alerts escalated").register(reg);
        this.sent        = Counter.builder("alert.delivery.sent").description("jobs delivered").register(reg);
        this.failed      = Counter.builder("alert.delivery.failed").description("jobs failed after retries").register(reg);
        this.unavailable = Counter.builder("alert.delivery.unavailable").description("jobs short-circuited by breaker").register(reg);
        this.skipped     = Counter.builder("alert.delivery.skipped").description("jobs for unconfigured channels").register(reg);
        this.closed = Counter.builder("alert.retention.closed").description("resolved alerts closed").register(reg);
        this.purged = Counter.builder("alert.retention.purged").description("closed alerts purged").register(reg);
        this.attempts = DistributionSummary.builder("alert.delivery.attempts")
                .description("attempt count per job").baseUnit("times").register(reg);
        this.sendTimer = Timer.builder("alert.delivery.send.time").description("adapter send time").register(reg);
    }

    public static AlertMetrics create(MeterRegistry reg) { return new AlertMetrics(reg); }

    public void incAdmitted(){ admitted.increment(); }
    public void incDeduplicated(){ deduplicated.increment(); }
    public void incEscalated(){ escalated.increment(); }
    public void incSent(){ sent.increment(); }
    public void incFailed(){ failed.increment(); }
    public void incUnavailable(){ unavailable.increment(); }
    public void incSkipped(){ skipped.increment(); }
    public void incClosed(int n){ closed.increment(n); }
    public void incPurged(int n){ purged.increment(n); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordSendNanos(long nanos){ sendTimer.record(nanos, TimeUnit.NANOSECONDS); }

    /** 熔断状态迁移, 按渠道和目标状态打标签 */
    public void incTransition(String channel, String to) {
        Counter.builder("alert.guard.transition")
                .description("circuit breaker state transitions")
                .tag("channel", channel)
                .tag("to", to)
                .register(reg)
                .increment();
    }
}
