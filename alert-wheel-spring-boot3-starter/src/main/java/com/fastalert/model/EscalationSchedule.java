package com.fastalert.model;

import com.fastalert.model.enums.ScheduleStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 升级计划, (alertId, level) 至多一条 PENDING
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EscalationSchedule {

    private String id;

    private String alertId;

    /** 升级层级, 从1开始 */
    private int level;

    /** 计划触发时间 */
    private Instant fireAt;

    private ScheduleStatus status;

    private Instant createdAt;

    private Instant updatedAt;

    public String key() {
        return key(alertId, level);
    }

    public static String key(String alertId, int level) {
        return alertId + "#" + level;
    }
}
