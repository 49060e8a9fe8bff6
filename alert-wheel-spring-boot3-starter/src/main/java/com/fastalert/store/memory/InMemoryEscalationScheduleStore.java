package com.fastalert.store.memory;

import com.fastalert.exception.DuplicateScheduleException;
import com.fastalert.model.EscalationSchedule;
import com.fastalert.model.enums.ScheduleStatus;
import com.fastalert.store.EscalationScheduleStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存实现, 以 alertId#level 为键保存最新一条计划
 */
public class InMemoryEscalationScheduleStore implements EscalationScheduleStore {

    private final Map<String, EscalationSchedule> schedules = new ConcurrentHashMap<>();

    @Override
    public EscalationSchedule upsert(EscalationSchedule schedule) {
        EscalationSchedule stored = schedules.compute(schedule.key(), (k, old) -> {
            EscalationSchedule.EscalationScheduleBuilder b = schedule.toBuilder();
            if (old != null && old.getStatus() == ScheduleStatus.PENDING) {
                b.id(old.getId()).createdAt(old.getCreatedAt());
            } else if (schedule.getId() == null) {
                b.id(UUID.randomUUID().toString());
            }
            return b.build();
        });
        return stored.toBuilder().build();
    }

    @Override
    public EscalationSchedule save(EscalationSchedule schedule) {
        EscalationSchedule stored = schedules.compute(schedule.key(), (k, old) -> {
            if (old != null && old.getStatus() == ScheduleStatus.PENDING
                    && !old.getId().equals(schedule.getId())) {
                throw new DuplicateScheduleException(schedule.getAlertId(), schedule.getLevel());
            }
            return schedule.getId() == null
                    ? schedule.toBuilder().id(UUID.randomUUID().toString()).build()
                    : schedule.toBuilder().build();
        });
        return stored.toBuilder().build();
    }

    @Override
    public Optional<EscalationSchedule> findPending(String alertId, int level) {
        EscalationSchedule s = schedules.get(EscalationSchedule.key(alertId, level));
        return s != null && s.getStatus() == ScheduleStatus.PENDING
                ? Optional.of(s.toBuilder().build()) : Optional.empty();
    }

    @Override
    public List<EscalationSchedule> findPendingByAlert(String alertId) {
        return findByAlert(alertId).stream()
                .filter(s -> s.getStatus() == ScheduleStatus.PENDING)
                .toList();
    }

    @Override
    public List<EscalationSchedule> findAllPending() {
        return schedules.values().stream()
                .filter(s -> s.getStatus() == ScheduleStatus.PENDING)
                .sorted(Comparator.comparing(EscalationSchedule::getFireAt))
                .map(s -> s.toBuilder().build())
                .toList();
    }

    @Override
    public List<EscalationSchedule> findByAlert(String alertId) {
        List<EscalationSchedule> ret = new ArrayList<>();
        for (EscalationSchedule s : schedules.values()) {
            if (s.getAlertId().equals(alertId)) {
                ret.add(s.toBuilder().build());
            }
        }
        ret.sort(Comparator.comparingInt(EscalationSchedule::getLevel));
        return ret;
    }

    @Override
    public boolean transition(String alertId, int level, ScheduleStatus to, Instant at) {
        boolean[] changed = {false};
        schedules.computeIfPresent(EscalationSchedule.key(alertId, level), (k, old) -> {
            if (old.getStatus() != ScheduleStatus.PENDING) {
                return old;
            }
            changed[0] = true;
            return old.toBuilder().status(to).updatedAt(at).build();
        });
        return changed[0];
    }

    @Override
    public int deleteByAlert(String alertId) {
        int before = schedules.size();
        schedules.values().removeIf(s -> s.getAlertId().equals(alertId));
        return Math.max(0, before - schedules.size());
    }
}
