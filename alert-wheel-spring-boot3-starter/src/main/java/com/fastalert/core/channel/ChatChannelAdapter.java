package com.fastalert.core.channel;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import com.fastalert.model.enums.Severity;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slack 兼容的 incoming webhook, 附件按级别着色
 */
public class ChatChannelAdapter extends AbstractHttpChannelAdapter {

    private static final Map<Severity, String> SEVERITY_COLORS = Map.of(
            Severity.CRITICAL, "#d9534f",
            Severity.HIGH, "#f0ad4e",
            Severity.MEDIUM, "#5bc0de",
            Severity.LOW, "#5cb85c"
    );

    private final AlertChannelProperties.Chat cfg;

    public ChatChannelAdapter(RestTemplate restTemplate, PayloadSerializer serializer,
                              AlertChannelProperties.Chat cfg) {
        super(restTemplate, serializer);
        this.cfg = cfg;
    }

    @Override
    public String channel() {
        return "chat";
    }

    @Override
    public boolean isConfigured() {
        return cfg.isEnabled() && hasText(cfg.getWebhookUrl());
    }

    @Override
    public DeliveryResult send(NotificationJob job) {
        RenderedPayload p = job.getPayload();
        String subject = p == null ? "" : p.getSubject();
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", SEVERITY_COLORS.getOrDefault(job.getSeverity(), "#777777"));
        attachment.put("title", subject);
        attachment.put("text", p == null ? "" : p.getBody());
        attachment.put("footer", "alert " + job.getAlertId());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", p != null && hasText(p.getRecipient()) ? p.getRecipient() : cfg.getChannel());
        body.put("username", cfg.getUsername());
        body.put("text", subject);
        body.put("attachments", List.of(attachment));
        return postJson(cfg.getWebhookUrl(), null, body, job);
    }
}
