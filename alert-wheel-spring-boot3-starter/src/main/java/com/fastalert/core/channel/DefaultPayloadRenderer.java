package com.fastalert.core.channel;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.core.spi.PayloadRenderer;
import com.fastalert.model.Alert;
import com.fastalert.model.RenderedPayload;
import com.fastalert.model.enums.NotificationReason;

import java.util.Map;

/**
 * 纯文本渲染, 真实部署由模板协作方替换
 * 标题格式 [SEVERITY] title, 收件人取渠道配置并替换 {team}
 */
public class DefaultPayloadRenderer implements PayloadRenderer {

    private static final String TEAM = "{team}";

    private final AlertChannelProperties props;

    public DefaultPayloadRenderer(AlertChannelProperties props) {
        this.props = props;
    }

    @Override
    public RenderedPayload render(Alert alert, String channel, NotificationReason reason) {
        String team = alert.getAssignedTeam() == null ? "" : alert.getAssignedTeam();
        String template = props.recipients().get(channel);
        String recipient = template == null ? team : template.replace(TEAM, team);
        return RenderedPayload.builder()
                .channel(channel)
                .recipient(recipient)
                .subject(subject(alert, reason))
                .body(body(alert, reason))
                .build();
    }

    private String subject(Alert alert, NotificationReason reason) {
        String s = "[" + alert.getSeverity() + "] " + alert.getTitle();
        return switch (reason) {
            case ACKNOWLEDGED -> s + " (acknowledged)";
            case RESOLVED -> s + " (resolved)";
            case ESCALATED -> s + " (escalated)";
            default -> s;
        };
    }

    private String body(Alert alert, NotificationReason reason) {
        StringBuilder sb = new StringBuilder(256);
        switch (reason) {
            case CREATED -> sb.append("New alert raised.");
            case ESCALATED -> sb.append("Alert escalated to level ").append(alert.getEscalationLevel())
                    .append(", severity ").append(alert.getSeverity()).append('.');
            case ACKNOWLEDGED -> sb.append("Alert acknowledged by ").append(alert.getAcknowledgedBy()).append('.');
            case RESOLVED -> sb.append("Alert resolved by ").append(alert.getResolvedBy()).append('.');
        }
        sb.append('\n');
        if (alert.getDescription() != null) {
            sb.append(alert.getDescription()).append('\n');
        }
        sb.append("\nKind: ").append(alert.getKind());
        if (alert.getSubjectType() != null) {
            sb.append("\nSubject: ").append(alert.getSubjectType()).append('/').append(alert.getSubjectId());
        }
        sb.append("\nTeam: ").append(alert.getAssignedTeam());
        sb.append("\nOccurrences: ").append(alert.getOccurrenceCount());
        Map<String, Object> attrs = alert.getAttributes();
        if (attrs != null && !attrs.isEmpty()) {
            sb.append("\nAttributes: ").append(attrs);
        }
        sb.append("\nAlert ID: ").append(alert.getId());
        return sb.toString();
    }
}
