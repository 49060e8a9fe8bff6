package com.fastalert.core.retention;

import com.fastalert.config.AlertWheelProperties;
import com.fastalert.core.lifecycle.AlertLifecycleManager;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.exception.AlertWheelException;
import com.fastalert.model.Alert;
import com.fastalert.store.AlertStore;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 保留期清理
 * RESOLVED 超过 resolved-retention 关闭; CLOSED 超过 archive-after 清除
 */
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final AlertStore alertStore;

    private final AlertLifecycleManager lifecycle;

    private final AlertMetrics metrics;

    private final AlertWheelProperties props;

    private final Clock clock;

    private ScheduledExecutorService sweepExecutor;

    public RetentionSweeper(AlertStore alertStore, AlertLifecycleManager lifecycle, AlertMetrics metrics,
                            AlertWheelProperties props, Clock clock) {
        this.alertStore = alertStore;
        this.lifecycle = lifecycle;
        this.metrics = metrics;
        this.props = props;
        this.clock = clock;
    }

    public synchronized void start() {
        AlertWheelProperties.Retention r = props.getRetention();
        if (!r.isEnabled() || sweepExecutor != null) {
            return;
        }
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("alert-retention-sweeper"));
        sweepExecutor.scheduleWithFixedDelay(this::sweep,
                r.getInitialDelay().toMillis(),
                r.getSweepPeriod().toMillis(),
                TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
            sweepExecutor = null;
        }
    }

    void sweep() {
        try {
            Instant now = clock.instant();
            int closed = closeExpired(now);
            int purged = purgeArchived(now);
            if (closed > 0 || purged > 0) {
                log.info("[Retention] closed={} purged={}", closed, purged);
            }
        } catch (Exception e) {
            log.error("[Retention] sweep error", e);
        }
    }

    /**
     * 关闭 resolvedAt 早于 now - resolved-retention 的告警
     */
    public int closeExpired(Instant now) {
        Instant cutoff = now.minus(props.getRetention().getResolvedRetention());
        int n = 0;
        for (Alert a : alertStore.findResolvedBefore(cutoff)) {
            try {
                lifecycle.close(a.getId());
                n++;
            } catch (AlertWheelException e) {
                // 扫描与清除之间状态已变
                log.debug("[Retention] skip close alert={}: {}", a.getId(), e.getMessage());
            }
        }
        metrics.incClosed(n);
        return n;
    }

    /**
     * 清除 closedAt 早于 now - archive-after 的告警
     */
    public int purgeArchived(Instant now) {
        Instant cutoff = now.minus(props.getRetention().getArchiveAfter());
        int n = 0;
        for (Alert a : alertStore.findClosedBefore(cutoff)) {
            try {
                lifecycle.purge(a.getId());
                n++;
            } catch (AlertWheelException e) {
                log.debug("[Retention] skip purge alert={}: {}", a.getId(), e.getMessage());
            }
        }
        metrics.incPurged(n);
        return n;
    }
}
