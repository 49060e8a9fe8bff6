package com.fastalert.store;

import com.fastalert.exception.DuplicateScheduleException;
import com.fastalert.model.EscalationSchedule;
import com.fastalert.model.enums.ScheduleStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 升级计划存储, 同一 (alertId, level) 至多一条 PENDING
 */
public interface EscalationScheduleStore {

    /**
     * 覆盖写入, 已有 PENDING 时替换它（保留原 id）
     */
    EscalationSchedule upsert(EscalationSchedule schedule);

    /**
     * 严格写入
     * @throws DuplicateScheduleException 已存在另一条 PENDING
     */
    EscalationSchedule save(EscalationSchedule schedule);

    Optional<EscalationSchedule> findPending(String alertId, int level);

    List<EscalationSchedule> findPendingByAlert(String alertId);

    /** 启动恢复用 */
    List<EscalationSchedule> findAllPending();

    List<EscalationSchedule> findByAlert(String alertId);

    /**
     * PENDING -> to, 仅当当前仍为 PENDING 时生效
     * @return 是否发生了迁移
     */
    boolean transition(String alertId, int level, ScheduleStatus to, Instant at);

    int deleteByAlert(String alertId);
}
