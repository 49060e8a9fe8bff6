package com.fastalert.core.lifecycle;

import com.fastalert.core.dispatch.NotificationFanout;
import com.fastalert.core.escalation.EscalationScheduler;
import com.fastalert.core.fingerprint.FingerprintEngine;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.route.RoutingEngine;
import com.fastalert.exception.AlertNotFoundException;
import com.fastalert.exception.InvalidTransitionException;
import com.fastalert.model.AdmitResult;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertFact;
import com.fastalert.model.AlertHistoryRecord;
import com.fastalert.model.RouteDecision;
import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.enums.HistoryAction;
import com.fastalert.model.enums.NotificationReason;
import com.fastalert.model.enums.ScheduleStatus;
import com.fastalert.model.enums.Severity;
import com.fastalert.store.AlertHistoryStore;
import com.fastalert.store.AlertStore;
import com.fastalert.store.DeliveryAuditStore;
import com.fastalert.store.EscalationScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * 告警状态机, 唯一修改告警状态的组件
 * 所有写操作按指纹加分段锁, 同一告警的上报/确认/解决/升级线性化, 不同指纹并行
 * 通知在锁外异步发出
 */
public class AlertLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleManager.class);

    public static final String SYSTEM_ACTOR = "system";

    private final AlertStore alertStore;

    private final AlertHistoryStore historyStore;

    private final EscalationScheduleStore scheduleStore;

    private final DeliveryAuditStore auditStore;

    private final FingerprintEngine fingerprints;

    private final RoutingEngine router;

    private final EscalationScheduler scheduler;

    private final NotificationFanout fanout;

    private final AlertMetrics metrics;

    private final KeyedLocks locks;

    private final Clock clock;

    public AlertLifecycleManager(AlertStore alertStore,
                                 AlertHistoryStore historyStore,
                                 EscalationScheduleStore scheduleStore,
                                 DeliveryAuditStore auditStore,
                                 FingerprintEngine fingerprints,
                                 RoutingEngine router,
                                 EscalationScheduler scheduler,
                                 NotificationFanout fanout,
                                 AlertMetrics metrics,
                                 KeyedLocks locks,
                                 Clock clock) {
        this.alertStore = alertStore;
        this.historyStore = historyStore;
        this.scheduleStore = scheduleStore;
        this.auditStore = auditStore;
        this.fingerprints = fingerprints;
        this.router = router;
        this.scheduler = scheduler;
        this.fanout = fanout;
        this.metrics = metrics;
        this.locks = locks;
        this.clock = clock;
        this.scheduler.bind(this::onEscalationDue);
    }

    /**
     * 上报: 命中活跃告警则计数 +1, 否则新建 OPEN 告警、挂升级计划并通知
     */
    public AdmitResult admit(AlertFact fact) {
        Objects.requireNonNull(fact, "fact");
        Objects.requireNonNull(fact.getKind(), "kind");
        Objects.requireNonNull(fact.getSeverity(), "severity");
        String fp = fingerprints.fingerprint(fact);

        AdmitResult result = locks.withLock(fp, () -> {
            Instant now = clock.instant();
            Optional<Alert> existing = alertStore.findActiveByFingerprint(fp);
            if (existing.isPresent()) {
                Alert a = existing.get();
                a.setOccurrenceCount(a.getOccurrenceCount() + 1);
                a.setUpdatedAt(now);
                return new AdmitResult(alertStore.update(a), false);
            }
            Alert a = Alert.builder()
                    .id(UUID.randomUUID().toString())
                    .fingerprint(fp)
                    .kind(fact.getKind())
                    .title(fact.getTitle())
                    .description(fact.getDescription())
                    .subjectType(fact.getSubjectType())
                    .subjectId(fact.getSubjectId())
                    .attributes(fact.getAttributes() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fact.getAttributes()))
                    .severity(fact.getSeverity())
                    .status(AlertStatus.OPEN)
                    .occurrenceCount(1)
                    .escalationLevel(0)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            applyRoute(a, router.route(a));
            Alert stored = alertStore.insert(a);
            history(stored.getId(), HistoryAction.CREATED, SYSTEM_ACTOR, null, now);
            scheduler.arm(stored.getId(), stored.getSeverity(), 1);
            return new AdmitResult(stored, true);
        });

        Alert alert = result.getAlert();
        if (result.isNew()) {
            metrics.incAdmitted();
            log.info("[Admit] new alert={} kind={} severity={} team={} channels={}",
                    alert.getId(), alert.getKind(), alert.getSeverity(), alert.getAssignedTeam(), alert.getChannels());
            fanout.notify(alert, NotificationReason.CREATED);
        } else {
            metrics.incDeduplicated();
            log.debug("[Admit] duplicate of alert={} occurrences={}", alert.getId(), alert.getOccurrenceCount());
        }
        return result;
    }

    /**
     * 确认, 仅 OPEN 可确认; 取消待触发升级
     */
    public Alert acknowledge(String alertId, String actor, String notes) {
        Alert updated = mutate(alertId, a -> {
            if (a.getStatus() != AlertStatus.OPEN) {
                throw new InvalidTransitionException(alertId, a.getStatus(), "acknowledge");
            }
            Instant now = clock.instant();
            a.setStatus(AlertStatus.ACKNOWLEDGED);
            a.setAcknowledgedAt(now);
            a.setAcknowledgedBy(actor);
            a.setAssignee(actor);
            a.setUpdatedAt(now);
            Alert saved = alertStore.update(a);
            scheduler.cancel(alertId);
            history(alertId, HistoryAction.ACKNOWLEDGED, actor, notes, now);
            return saved;
        });
        log.info("[Lifecycle] alert={} acknowledged by {}", alertId, actor);
        fanout.notify(updated, NotificationReason.ACKNOWLEDGED);
        return updated;
    }

    /**
     * 解决, OPEN / ACKNOWLEDGED 可解决; 退出去重窗口
     */
    public Alert resolve(String alertId, String actor, String notes) {
        Alert updated = mutate(alertId, a -> {
            if (a.getStatus() != AlertStatus.OPEN && a.getStatus() != AlertStatus.ACKNOWLEDGED) {
                throw new InvalidTransitionException(alertId, a.getStatus(), "resolve");
            }
            Instant now = clock.instant();
            a.setStatus(AlertStatus.RESOLVED);
            a.setResolvedAt(now);
            a.setResolvedBy(actor);
            a.setUpdatedAt(now);
            Alert saved = alertStore.update(a);
            scheduler.cancel(alertId);
            history(alertId, HistoryAction.RESOLVED, actor, notes, now);
            return saved;
        });
        log.info("[Lifecycle] alert={} resolved by {}", alertId, actor);
        fanout.notify(updated, NotificationReason.RESOLVED);
        return updated;
    }

    /**
     * 升级: 级别 +1、重新路由、通知, OPEN 时挂下一级计划
     * 已是 CRITICAL 视为终止, 不做任何修改
     */
    public Alert escalate(String alertId) {
        boolean[] escalated = {false};
        Alert updated = mutate(alertId, a -> {
            if (a.getStatus() != AlertStatus.OPEN && a.getStatus() != AlertStatus.ACKNOWLEDGED) {
                throw new InvalidTransitionException(alertId, a.getStatus(), "escalate");
            }
            if (a.getSeverity().isMax()) {
                log.info("[Escalation] alert={} already {}, nothing to escalate", alertId, a.getSeverity());
                return a;
            }
            Instant now = clock.instant();
            Severity from = a.getSeverity();
            a.setSeverity(from.next());
            a.setEscalationLevel(a.getEscalationLevel() + 1);
            a.setUpdatedAt(now);
            applyRoute(a, router.route(a));
            Alert saved = alertStore.update(a);
            history(alertId, HistoryAction.ESCALATED, SYSTEM_ACTOR,
                    from + " -> " + saved.getSeverity() + ", team " + saved.getAssignedTeam(), now);
            // 手动升级时本级计划可能仍在途, 先撤销再挂下一级
            scheduler.cancel(alertId);
            if (saved.getStatus() == AlertStatus.OPEN) {
                scheduler.arm(alertId, saved.getSeverity(), saved.getEscalationLevel() + 1);
            }
            escalated[0] = true;
            return saved;
        });
        if (escalated[0]) {
            metrics.incEscalated();
            log.warn("[Escalation] alert={} escalated to {} level={} team={} channels={}",
                    alertId, updated.getSeverity(), updated.getEscalationLevel(),
                    updated.getAssignedTeam(), updated.getChannels());
            fanout.notify(updated, NotificationReason.ESCALATED);
        }
        return updated;
    }

    /**
     * 保留期到期: RESOLVED -> CLOSED
     */
    public Alert close(String alertId) {
        return mutate(alertId, a -> {
            if (a.getStatus() != AlertStatus.RESOLVED) {
                throw new InvalidTransitionException(alertId, a.getStatus(), "close");
            }
            Instant now = clock.instant();
            a.setStatus(AlertStatus.CLOSED);
            a.setClosedAt(now);
            a.setUpdatedAt(now);
            Alert saved = alertStore.update(a);
            history(alertId, HistoryAction.CLOSED, SYSTEM_ACTOR, "retention elapsed", now);
            return saved;
        });
    }

    /**
     * 归档清除: 删除 CLOSED 告警及其计划、审计、流水
     */
    public void purge(String alertId) {
        mutate(alertId, a -> {
            if (a.getStatus() != AlertStatus.CLOSED) {
                throw new InvalidTransitionException(alertId, a.getStatus(), "purge");
            }
            alertStore.delete(alertId);
            scheduleStore.deleteByAlert(alertId);
            auditStore.deleteByAlert(alertId);
            historyStore.deleteByAlert(alertId);
            return a;
        });
        log.debug("[Retention] alert={} purged", alertId);
    }

    public Alert get(String alertId) {
        return alertStore.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    /**
     * 升级计划到期回调, 在锁内复核当前状态而不是触发时的缓存状态
     * 锁可重入, escalate 与确认/解决在同一把锁上串行
     */
    void onEscalationDue(String alertId, int level) {
        Optional<Alert> snapshot = alertStore.findById(alertId);
        if (snapshot.isEmpty()) {
            scheduleStore.transition(alertId, level, ScheduleStatus.SUPPRESSED, clock.instant());
            return;
        }
        locks.withLock(snapshot.get().getFingerprint(), () -> {
            Instant now = clock.instant();
            if (scheduleStore.findPending(alertId, level).isEmpty()) {
                log.debug("[Escalation] alert={} level={} no longer pending, skip", alertId, level);
                return;
            }
            Alert a = alertStore.findById(alertId).orElse(null);
            if (a == null || a.getStatus() != AlertStatus.OPEN) {
                scheduleStore.transition(alertId, level, ScheduleStatus.SUPPRESSED, now);
                log.info("[Escalation] alert={} level={} suppressed, status={}",
                        alertId, level, a == null ? null : a.getStatus());
                return;
            }
            scheduleStore.transition(alertId, level, ScheduleStatus.FIRED, now);
            escalate(alertId);
        });
    }

    private Alert mutate(String alertId, UnaryOperator<Alert> action) {
        Alert snapshot = get(alertId);
        return locks.withLock(snapshot.getFingerprint(), () -> {
            // 锁内重新读取
            Alert a = get(alertId);
            return action.apply(a);
        });
    }

    private void applyRoute(Alert a, RouteDecision decision) {
        a.setAssignedTeam(decision.getTeam());
        a.setChannels(decision.getChannels());
    }

    private void history(String alertId, HistoryAction action, String actor, String notes, Instant at) {
        historyStore.append(AlertHistoryRecord.builder()
                .alertId(alertId)
                .action(action)
                .actor(actor)
                .notes(notes)
                .at(at)
                .build());
    }
}
