package com.fastalert.core;

import com.fastalert.core.dispatch.BatchDispatcher;
import com.fastalert.core.escalation.EscalationScheduler;
import com.fastalert.core.guard.ChannelHealthTracker;
import com.fastalert.core.lifecycle.AlertLifecycleManager;
import com.fastalert.core.retention.RetentionSweeper;
import com.fastalert.core.spi.ChannelAdapter;
import com.fastalert.model.AdmitResult;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertFact;
import com.fastalert.model.AlertFilter;
import com.fastalert.model.AlertHistoryRecord;
import com.fastalert.model.BatchReport;
import com.fastalert.model.ChannelHealth;
import com.fastalert.model.DeliveryAuditRecord;
import com.fastalert.model.NotificationJob;
import com.fastalert.store.AlertHistoryStore;
import com.fastalert.store.AlertStore;
import com.fastalert.store.DeliveryAuditStore;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 告警管线对外入口
 */
public class AlertPipeline {

    private static final Logger log = LoggerFactory.getLogger(AlertPipeline.class);

    private final AlertLifecycleManager lifecycle;

    private final AlertStore alertStore;

    private final DeliveryAuditStore auditStore;

    private final AlertHistoryStore historyStore;

    private final BatchDispatcher dispatcher;

    private final EscalationScheduler scheduler;

    private final ChannelHealthTracker guard;

    private final RetentionSweeper sweeper;

    /** 升级计划与投递重试共用的时间轮 */
    private final HashedWheelTimer timer;

    /** 升级执行线程池 */
    private final ExecutorService escalationExecutor;

    public AlertPipeline(AlertLifecycleManager lifecycle,
                         AlertStore alertStore,
                         DeliveryAuditStore auditStore,
                         AlertHistoryStore historyStore,
                         BatchDispatcher dispatcher,
                         EscalationScheduler scheduler,
                         ChannelHealthTracker guard,
                         RetentionSweeper sweeper,
                         HashedWheelTimer timer,
                         ExecutorService escalationExecutor) {
        this.lifecycle = lifecycle;
        this.alertStore = alertStore;
        this.auditStore = auditStore;
        this.historyStore = historyStore;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.guard = guard;
        this.sweeper = sweeper;
        this.timer = timer;
        this.escalationExecutor = escalationExecutor;
    }

    /**
     * 协作方上报入口
     * @return 告警 id（新建或命中的已有告警）
     */
    public String submitAlertFact(AlertFact fact) {
        return lifecycle.admit(fact).getAlert().getId();
    }

    public AdmitResult admit(AlertFact fact) {
        return lifecycle.admit(fact);
    }

    public Alert getAlert(String id) {
        return lifecycle.get(id);
    }

    public List<Alert> listAlerts(AlertFilter filter) {
        return alertStore.list(filter);
    }

    public Alert acknowledge(String id, String actor, String notes) {
        return lifecycle.acknowledge(id, actor, notes);
    }

    public Alert resolve(String id, String actor, String notes) {
        return lifecycle.resolve(id, actor, notes);
    }

    public Alert escalate(String id) {
        return lifecycle.escalate(id);
    }

    /**
     * 直接派发已渲染好的任务
     */
    public BatchReport dispatch(List<NotificationJob> jobs) {
        return dispatcher.dispatch(jobs);
    }

    /**
     * 已注册渠道与出现过的渠道的熔断快照
     */
    public List<ChannelHealth> getChannelHealth() {
        Set<String> channels = new TreeSet<>(dispatcher.adapters().keySet());
        guard.snapshot().forEach(h -> channels.add(h.getChannel()));
        List<ChannelHealth> ret = new ArrayList<>(channels.size());
        channels.forEach(c -> ret.add(guard.health(c)));
        return ret;
    }

    public List<DeliveryAuditRecord> getDeliveryAudit(String alertId) {
        lifecycle.get(alertId);
        return auditStore.findByAlert(alertId);
    }

    public List<AlertHistoryRecord> getHistory(String alertId) {
        lifecycle.get(alertId);
        return historyStore.findByAlert(alertId);
    }

    /**
     * 渠道名 -> 是否配置完整
     */
    public Map<String, Boolean> validateChannels() {
        Map<String, Boolean> ret = new LinkedHashMap<>();
        new TreeSet<>(dispatcher.adapters().keySet()).forEach(c -> {
            ChannelAdapter a = dispatcher.adapters().get(c);
            ret.put(c, a.isConfigured());
        });
        return ret;
    }

    /**
     * 恢复升级计划并启动保留期清理
     */
    protected int start() {
        int recovered = scheduler.recover();
        sweeper.start();
        return recovered;
    }

    protected void gracefulShutdown(long awaitSecond) {
        sweeper.stop();
        // 停止时间轮: 升级计划留在库里保持 PENDING, 未触发的投递重试直接收尾
        int drained = drainWheel();
        long awaitMs = Math.max(1, awaitSecond) * 1000L;
        dispatcher.shutdown(awaitMs);
        escalationExecutor.shutdown();
        try {
            if (!escalationExecutor.awaitTermination(Math.min(2000, awaitMs), TimeUnit.MILLISECONDS)) {
                escalationExecutor.shutdownNow();
                log.warn("[Alert-Wheel] escalationExecutor forced shutdown");
            }
        } catch (InterruptedException ie) {
            escalationExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Alert-Wheel] graceful shutdown done, drainedWheelTasks={}", drained);
    }

    private int drainWheel() {
        Set<Timeout> unProcessed = timer.stop();
        if (unProcessed == null || unProcessed.isEmpty()) {
            log.info("[Alert-Wheel] timer stopped with no unprocessed timeouts.");
            return 0;
        }
        int escalations = 0, retries = 0;
        for (Timeout t : unProcessed) {
            if (t == null || !(t.task() instanceof WheelTask wt)) {
                continue;
            }
            if (wt.getKind() == WheelTask.Kind.DELIVERY_RETRY) {
                wt.abort();
                retries++;
            } else {
                escalations++;
            }
        }
        log.info("[Alert-Wheel] {} escalation schedule(s) left pending, {} delivery retr(ies) aborted",
                escalations, retries);
        return escalations + retries;
    }
}
