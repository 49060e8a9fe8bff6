package com.fastalert.model;

import com.fastalert.model.enums.Severity;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 路由规则
 * kinds/severities/attributes 为空表示不限制
 */
@Value
@Builder
public class RoutingRule {

    String name;

    /** 越大越优先 */
    int priority;

    @Singular
    Set<String> kinds;

    @Singular
    Set<Severity> severities;

    /** 属性等值匹配 */
    @Singular
    Map<String, String> attributes;

    String team;

    @Singular
    List<String> channels;

    public boolean matches(Alert alert) {
        if (!kinds.isEmpty() && !kinds.contains(alert.getKind())) {
            return false;
        }
        if (!severities.isEmpty() && !severities.contains(alert.getSeverity())) {
            return false;
        }
        Map<String, Object> attrs = alert.getAttributes() == null ? Map.of() : alert.getAttributes();
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            Object actual = attrs.get(e.getKey());
            if (actual == null || !Objects.equals(e.getValue(), String.valueOf(actual))) {
                return false;
            }
        }
        return true;
    }
}
