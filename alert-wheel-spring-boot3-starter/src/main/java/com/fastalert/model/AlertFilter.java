package com.fastalert.model;

import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.enums.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * 查询条件, 字段为空表示不过滤
 */
@Value
@Builder
public class AlertFilter {

    AlertStatus status;

    Severity severity;

    String team;

    String kind;

    public static AlertFilter all() {
        return AlertFilter.builder().build();
    }

    public boolean matches(Alert a) {
        return (status == null || status == a.getStatus())
                && (severity == null || severity == a.getSeverity())
                && (team == null || team.equals(a.getAssignedTeam()))
                && (kind == null || kind.equals(a.getKind()));
    }
}
