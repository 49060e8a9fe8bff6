package com.fastalert.store;

import com.fastalert.model.DeliveryAuditRecord;

import java.util.List;

/**
 * 投递审计, 按追加顺序返回
 */
public interface DeliveryAuditStore {

    void append(DeliveryAuditRecord record);

    List<DeliveryAuditRecord> findByAlert(String alertId);

    int deleteByAlert(String alertId);
}
