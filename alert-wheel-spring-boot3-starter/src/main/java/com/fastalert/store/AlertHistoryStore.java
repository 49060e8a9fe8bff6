package com.fastalert.store;

import com.fastalert.model.AlertHistoryRecord;

import java.util.List;

/**
 * 生命周期流水
 */
public interface AlertHistoryStore {

    void append(AlertHistoryRecord record);

    List<AlertHistoryRecord> findByAlert(String alertId);

    int deleteByAlert(String alertId);
}
