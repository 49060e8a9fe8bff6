package com.fastalert.store.memory;

import com.fastalert.model.AlertHistoryRecord;
import com.fastalert.store.AlertHistoryStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAlertHistoryStore implements AlertHistoryStore {

    private final Map<String, List<AlertHistoryRecord>> records = new ConcurrentHashMap<>();

    @Override
    public void append(AlertHistoryRecord record) {
        records.compute(record.getAlertId(), (k, list) -> {
            List<AlertHistoryRecord> l = list == null ? new ArrayList<>() : list;
            l.add(record);
            return l;
        });
    }

    @Override
    public List<AlertHistoryRecord> findByAlert(String alertId) {
        List<AlertHistoryRecord> ret = new ArrayList<>();
        records.computeIfPresent(alertId, (k, list) -> {
            ret.addAll(list);
            return list;
        });
        return ret;
    }

    @Override
    public int deleteByAlert(String alertId) {
        List<AlertHistoryRecord> removed = records.remove(alertId);
        return removed == null ? 0 : removed.size();
    }
}
