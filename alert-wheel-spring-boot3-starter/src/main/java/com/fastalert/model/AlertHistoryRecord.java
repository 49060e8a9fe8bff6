package com.fastalert.model;

import com.fastalert.model.enums.HistoryAction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AlertHistoryRecord {

    String alertId;

    HistoryAction action;

    /** 操作人, 系统动作为 system */
    String actor;

    String notes;

    Instant at;
}
