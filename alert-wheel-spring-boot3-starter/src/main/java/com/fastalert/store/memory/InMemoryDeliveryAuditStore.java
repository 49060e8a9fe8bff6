package com.fastalert.store.memory;

import com.fastalert.model.DeliveryAuditRecord;
import com.fastalert.store.DeliveryAuditStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDeliveryAuditStore implements DeliveryAuditStore {

    private final Map<String, List<DeliveryAuditRecord>> records = new ConcurrentHashMap<>();

    @Override
    public void append(DeliveryAuditRecord record) {
        // compute 内追加, 保证同一告警的追加顺序与完成顺序一致
        records.compute(record.getAlertId(), (k, list) -> {
            List<DeliveryAuditRecord> l = list == null ? new ArrayList<>() : list;
            l.add(record);
            return l;
        });
    }

    @Override
    public List<DeliveryAuditRecord> findByAlert(String alertId) {
        List<DeliveryAuditRecord> ret = new ArrayList<>();
        records.computeIfPresent(alertId, (k, list) -> {
            ret.addAll(list);
            return list;
        });
        return ret;
    }

    @Override
    public int deleteByAlert(String alertId) {
        List<DeliveryAuditRecord> removed = records.remove(alertId);
        return removed == null ? 0 : removed.size();
    }
}
