package com.fastalert.core.escalation;

import com.fastalert.config.AlertWheelProperties;
import com.fastalert.core.WheelTask;
import com.fastalert.model.EscalationSchedule;
import com.fastalert.model.enums.ScheduleStatus;
import com.fastalert.model.enums.Severity;
import com.fastalert.store.EscalationScheduleStore;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 升级计划调度
 * 计划先落库再挂时间轮; 触发时交给 handler 在执行线程池里复核状态后再升级
 */
public class EscalationScheduler {

    private static final Logger log = LoggerFactory.getLogger(EscalationScheduler.class);

    /**
     * 计划到期回调, 由生命周期管理器实现
     */
    @FunctionalInterface
    public interface EscalationHandler {
        void onDue(String alertId, int level);
    }

    private final HashedWheelTimer timer;

    private final EscalationScheduleStore store;

    private final ExecutorService executor;

    private final AlertWheelProperties props;

    private final Clock clock;

    /** alertId#level -> 时间轮句柄, 取消 O(1) */
    private final Map<String, Timeout> armed = new ConcurrentHashMap<>();

    private volatile EscalationHandler handler;

    public EscalationScheduler(HashedWheelTimer timer,
                               EscalationScheduleStore store,
                               ExecutorService executor,
                               AlertWheelProperties props,
                               Clock clock) {
        this.timer = timer;
        this.store = store;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    public void bind(EscalationHandler handler) {
        this.handler = handler;
    }

    /**
     * 挂一条升级计划, 同一 (alertId, level) 覆盖旧计划
     * @return 计划 id, 升级关闭时返回 null
     */
    public String arm(String alertId, Severity severity, int level) {
        if (!props.getEscalation().isEnabled()) {
            return null;
        }
        Instant now = clock.instant();
        Duration delay = props.getEscalation().delayFor(severity);
        EscalationSchedule schedule = store.upsert(EscalationSchedule.builder()
                .alertId(alertId)
                .level(level)
                .fireAt(now.plus(delay))
                .status(ScheduleStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build());
        armTimer(schedule, delay);
        log.info("[Escalation] armed alert={} level={} severity={} fireAt={}",
                alertId, level, severity, schedule.getFireAt());
        return schedule.getId();
    }

    /**
     * 取消告警的全部待触发计划
     * @return 取消条数
     */
    public int cancel(String alertId) {
        int n = 0;
        Instant now = clock.instant();
        for (EscalationSchedule s : store.findPendingByAlert(alertId)) {
            Timeout t = armed.remove(s.key());
            if (t != null) {
                t.cancel();
            }
            if (store.transition(alertId, s.getLevel(), ScheduleStatus.CANCELLED, now)) {
                n++;
            }
        }
        if (n > 0) {
            log.info("[Escalation] cancelled {} pending schedule(s) for alert={}", n, alertId);
        }
        return n;
    }

    /**
     * 启动时把库里 PENDING 的计划重新挂上时间轮, 已过期的下一刻触发
     */
    public int recover() {
        List<EscalationSchedule> pending = store.findAllPending();
        Instant now = clock.instant();
        for (EscalationSchedule s : pending) {
            Duration delay = Duration.between(now, s.getFireAt());
            armTimer(s, delay.isNegative() ? Duration.ZERO : delay);
        }
        if (!pending.isEmpty()) {
            log.info("[Escalation] recovered {} pending schedule(s)", pending.size());
        }
        return pending.size();
    }

    /** 时间轮上挂着的计划数 */
    public int armedCount() {
        return armed.size();
    }

    private void armTimer(EscalationSchedule schedule, Duration delay) {
        String key = schedule.key();
        String alertId = schedule.getAlertId();
        int level = schedule.getLevel();
        WheelTask task = new WheelTask(WheelTask.Kind.ESCALATION, key, () -> fire(key, alertId, level), null);
        Timeout fresh = timer.newTimeout(task, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        Timeout old = armed.put(key, fresh);
        if (old != null && old != fresh) {
            old.cancel();
        }
    }

    /**
     * 时间轮线程上执行, 只做投递
     */
    private void fire(String key, String alertId, int level) {
        // 只移除已到期的句柄, 同键刚被覆盖挂上的新句柄保留
        armed.computeIfPresent(key, (k, t) -> t.isExpired() ? null : t);
        EscalationHandler h = handler;
        if (h == null) {
            log.warn("[Escalation] no handler bound, alert={} level={} left pending", alertId, level);
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    h.onDue(alertId, level);
                } catch (Exception e) {
                    log.error("[Escalation] handler failed, alert={} level={}", alertId, level, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Escalation] executor rejected alert={} level={}, schedule stays pending", alertId, level);
        }
    }
}
