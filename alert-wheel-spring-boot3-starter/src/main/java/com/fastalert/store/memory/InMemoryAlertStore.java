package com.fastalert.store.memory;

import com.fastalert.model.Alert;
import com.fastalert.model.AlertFilter;
import com.fastalert.model.enums.AlertStatus;
import com.fastalert.store.AlertStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存实现
 * 同一指纹的写入由调用方按指纹串行化, 这里只保证单条操作原子
 */
public class InMemoryAlertStore implements AlertStore {

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();

    /** fingerprint -> 活跃告警 id */
    private final Map<String, String> activeIndex = new ConcurrentHashMap<>();

    @Override
    public Alert insert(Alert alert) {
        Objects.requireNonNull(alert.getId(), "id");
        Alert stored = alert.copy();
        if (alerts.putIfAbsent(stored.getId(), stored) != null) {
            throw new IllegalStateException("alert id already exists: " + stored.getId());
        }
        if (!stored.getStatus().isTerminal()) {
            activeIndex.put(stored.getFingerprint(), stored.getId());
        }
        return stored.copy();
    }

    @Override
    public Alert update(Alert alert) {
        Alert stored = alert.copy();
        if (alerts.replace(stored.getId(), stored) == null) {
            throw new IllegalStateException("alert not stored: " + stored.getId());
        }
        if (stored.getStatus().isTerminal()) {
            activeIndex.remove(stored.getFingerprint(), stored.getId());
        }
        return stored.copy();
    }

    @Override
    public Optional<Alert> findById(String id) {
        Alert a = alerts.get(id);
        return a == null ? Optional.empty() : Optional.of(a.copy());
    }

    @Override
    public Optional<Alert> findActiveByFingerprint(String fingerprint) {
        String id = activeIndex.get(fingerprint);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<Alert> list(AlertFilter filter) {
        AlertFilter f = filter == null ? AlertFilter.all() : filter;
        return alerts.values().stream()
                .filter(f::matches)
                .sorted(Comparator.comparing(Alert::getCreatedAt).thenComparing(Alert::getId))
                .map(Alert::copy)
                .toList();
    }

    @Override
    public List<Alert> findResolvedBefore(Instant cutoff) {
        return alerts.values().stream()
                .filter(a -> a.getStatus() == AlertStatus.RESOLVED)
                .filter(a -> a.getResolvedAt() != null && a.getResolvedAt().isBefore(cutoff))
                .map(Alert::copy)
                .toList();
    }

    @Override
    public List<Alert> findClosedBefore(Instant cutoff) {
        return alerts.values().stream()
                .filter(a -> a.getStatus() == AlertStatus.CLOSED)
                .filter(a -> a.getClosedAt() != null && a.getClosedAt().isBefore(cutoff))
                .map(Alert::copy)
                .toList();
    }

    @Override
    public boolean delete(String id) {
        Alert removed = alerts.remove(id);
        if (removed == null) {
            return false;
        }
        activeIndex.remove(removed.getFingerprint(), id);
        return true;
    }
}
