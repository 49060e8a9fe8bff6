package com.fastalert.core.route;

import com.fastalert.config.AlertRoutingProperties;
import com.fastalert.model.Alert;
import com.fastalert.model.RouteDecision;
import com.fastalert.model.RoutingRule;
import com.fastalert.model.enums.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 路由: priority 降序、同优先级按注册顺序, 首条命中生效
 * CRITICAL 额外追加升级渠道
 */
public class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final String defaultTeam;

    private final List<String> defaultChannels;

    private final List<String> escalationChannels;

    /** 注册顺序 */
    private final List<RoutingRule> registered = new ArrayList<>();

    /** 排好序的快照 */
    private volatile List<RoutingRule> ordered = List.of();

    public RoutingEngine(AlertRoutingProperties props) {
        this.defaultTeam = props.getDefaultTeam();
        this.defaultChannels = List.copyOf(props.getDefaultChannels());
        this.escalationChannels = List.copyOf(props.getEscalationChannels());
        if (props.getRules() != null) {
            props.getRules().forEach(r -> addRule(toRule(r)));
        }
    }

    public synchronized RoutingEngine addRule(RoutingRule rule) {
        registered.add(rule);
        List<RoutingRule> copy = new ArrayList<>(registered);
        // List.sort 是稳定排序, 同优先级保持注册顺序
        copy.sort(Comparator.comparingInt(RoutingRule::getPriority).reversed());
        ordered = List.copyOf(copy);
        return this;
    }

    public List<RoutingRule> rules() {
        return ordered;
    }

    public RouteDecision route(Alert alert) {
        RoutingRule matched = null;
        for (RoutingRule rule : ordered) {
            if (rule.matches(alert)) {
                matched = rule;
                break;
            }
        }
        String team = matched == null || matched.getTeam() == null ? defaultTeam : matched.getTeam();
        Set<String> channels = new LinkedHashSet<>(
                matched == null || matched.getChannels().isEmpty() ? defaultChannels : matched.getChannels());
        if (alert.getSeverity() == Severity.CRITICAL) {
            channels.addAll(escalationChannels);
        }
        RouteDecision decision = new RouteDecision(team, List.copyOf(channels),
                matched == null ? null : matched.getName());
        log.debug("[Route] alert={} kind={} severity={} -> team={} channels={} rule={}",
                alert.getId(), alert.getKind(), alert.getSeverity(),
                decision.getTeam(), decision.getChannels(), decision.getMatchedRule());
        return decision;
    }

    private static RoutingRule toRule(AlertRoutingProperties.Rule r) {
        return RoutingRule.builder()
                .name(r.getName())
                .priority(r.getPriority())
                .kinds(r.getKinds())
                .severities(r.getSeverities())
                .attributes(r.getAttributes())
                .team(r.getTeam())
                .channels(r.getChannels())
                .build();
    }
}
