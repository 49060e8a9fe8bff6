package com.fastalert.core.channel;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通用 webhook, POST JSON
 */
public class WebhookChannelAdapter extends AbstractHttpChannelAdapter {

    private final AlertChannelProperties.Webhook cfg;

    public WebhookChannelAdapter(RestTemplate restTemplate, PayloadSerializer serializer,
                                 AlertChannelProperties.Webhook cfg) {
        super(restTemplate, serializer);
        this.cfg = cfg;
    }

    @Override
    public String channel() {
        return "webhook";
    }

    @Override
    public boolean isConfigured() {
        return cfg.isEnabled() && hasText(cfg.getUrl());
    }

    @Override
    public DeliveryResult send(NotificationJob job) {
        RenderedPayload p = job.getPayload();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("alertId", job.getAlertId());
        body.put("jobId", job.getJobId());
        body.put("reason", job.getReason());
        body.put("severity", job.getSeverity());
        body.put("attempt", job.getAttempt());
        if (p != null) {
            body.put("recipient", p.getRecipient());
            body.put("subject", p.getSubject());
            body.put("body", p.getBody());
        }
        return postJson(cfg.getUrl(), cfg.getHeaders(), body, job);
    }
}
