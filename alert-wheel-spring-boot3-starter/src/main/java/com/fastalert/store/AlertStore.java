package com.fastalert.store;

import com.fastalert.model.Alert;
import com.fastalert.model.AlertFilter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 告警存储
 * 读写都是拷贝; 只有 AlertLifecycleManager 调用写方法
 */
public interface AlertStore {

    /** 新建, 同时登记到活跃指纹索引 */
    Alert insert(Alert alert);

    /** 覆盖保存, 进入终态时移出活跃指纹索引 */
    Alert update(Alert alert);

    Optional<Alert> findById(String id);

    /** 指纹对应的非终态告警 */
    Optional<Alert> findActiveByFingerprint(String fingerprint);

    /** 按 createdAt 升序 */
    List<Alert> list(AlertFilter filter);

    /** resolvedAt 早于 cutoff 的 RESOLVED 告警 */
    List<Alert> findResolvedBefore(Instant cutoff);

    /** closedAt 早于 cutoff 的 CLOSED 告警 */
    List<Alert> findClosedBefore(Instant cutoff);

    boolean delete(String id);
}
