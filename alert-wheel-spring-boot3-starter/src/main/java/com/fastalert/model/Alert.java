package com.fastalert.model;

import com.fastalert.model.enums.AlertStatus;
import com.fastalert.model.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 告警记录
 * 状态字段只允许 AlertLifecycleManager 修改
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;

    /** 去重指纹 */
    private String fingerprint;

    private String kind;

    private String title;

    private String description;

    private String subjectType;

    private String subjectId;

    private Map<String, Object> attributes;

    /** 只能经升级提高 */
    private Severity severity;

    private AlertStatus status;

    /** 重复上报次数, 只增不减 */
    private int occurrenceCount;

    /** 已升级次数 */
    private int escalationLevel;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant acknowledgedAt;

    private String acknowledgedBy;

    private Instant resolvedAt;

    private String resolvedBy;

    private Instant closedAt;

    /** 路由得到的负责团队 */
    private String assignedTeam;

    /** 处理人 */
    private String assignee;

    /** 路由得到的通知渠道 */
    private List<String> channels;

    /**
     * 拷贝一份, 存储层读写都走拷贝, 避免外部引用绕过状态机
     */
    public Alert copy() {
        return toBuilderCopy().build();
    }

    private AlertBuilder toBuilderCopy() {
        return Alert.builder()
                .id(id)
                .fingerprint(fingerprint)
                .kind(kind)
                .title(title)
                .description(description)
                .subjectType(subjectType)
                .subjectId(subjectId)
                .attributes(attributes == null ? null : new LinkedHashMap<>(attributes))
                .severity(severity)
                .status(status)
                .occurrenceCount(occurrenceCount)
                .escalationLevel(escalationLevel)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .acknowledgedAt(acknowledgedAt)
                .acknowledgedBy(acknowledgedBy)
                .resolvedAt(resolvedAt)
                .resolvedBy(resolvedBy)
                .closedAt(closedAt)
                .assignedTeam(assignedTeam)
                .assignee(assignee)
                .channels(channels == null ? null : new ArrayList<>(channels));
    }
}
