package com.fastalert.config;

import com.fastalert.model.enums.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * alert:
 *   routing:
 *     default-team: ops-team
 *     default-channels: [log, email]
 *     escalation-channels: [sms]
 *     rules:
 *       - name: security
 *         priority: 100
 *         kinds: [security]
 *         team: security-team
 *         channels: [email, chat]
 */
@Data
@ConfigurationProperties(prefix = "alert.routing")
public class AlertRoutingProperties {

    /** 未命中任何规则时的团队 */
    private String defaultTeam = "ops-team";

    /** 未命中任何规则时的渠道 */
    private List<String> defaultChannels = new ArrayList<>(List.of("log", "email"));

    /** CRITICAL 无条件追加的渠道 */
    private List<String> escalationChannels = new ArrayList<>(List.of("sms"));

    /** 按 priority 降序、声明顺序匹配 */
    private List<Rule> rules = new ArrayList<>();

    @Data
    public static class Rule {
        private String name;
        private int priority;
        private Set<String> kinds = new LinkedHashSet<>();
        private Set<Severity> severities = new LinkedHashSet<>();
        private Map<String, String> attributes = new LinkedHashMap<>();
        private String team;
        private List<String> channels = new ArrayList<>();
    }
}
