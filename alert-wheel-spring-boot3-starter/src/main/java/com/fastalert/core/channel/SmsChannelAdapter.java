package com.fastalert.core.channel;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 短信网关, Bearer 鉴权, 正文截断到 160 字符
 * 网关响应体中的 id / messageId 作为回执号
 */
public class SmsChannelAdapter extends AbstractHttpChannelAdapter {

    private static final int MAX_LENGTH = 160;

    private final AlertChannelProperties.Sms cfg;

    public SmsChannelAdapter(RestTemplate restTemplate, PayloadSerializer serializer,
                             AlertChannelProperties.Sms cfg) {
        super(restTemplate, serializer);
        this.cfg = cfg;
    }

    @Override
    public String channel() {
        return "sms";
    }

    @Override
    public boolean isConfigured() {
        return cfg.isEnabled() && hasText(cfg.getEndpoint()) && hasText(cfg.getApiKey());
    }

    @Override
    public DeliveryResult send(NotificationJob job) {
        RenderedPayload p = job.getPayload();
        if (p == null || !hasText(p.getRecipient())) {
            return DeliveryResult.rejected("no sms recipient");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", p.getRecipient());
        body.put("message", shorten(p.getSubject()));
        body.put("reference", job.getJobId());
        return postJson(cfg.getEndpoint(), Map.of("Authorization", "Bearer " + cfg.getApiKey()), body, job);
    }

    @Override
    protected String providerRef(ResponseEntity<String> resp, NotificationJob job) {
        try {
            Optional<String> id = serializer.readText(resp.getBody(), "messageId", "id");
            if (id.isPresent()) {
                return id.get();
            }
        } catch (IllegalArgumentException e) {
            log.debug("[Channel-sms] unparseable gateway response for job={}", job.getJobId());
        }
        return super.providerRef(resp, job);
    }

    static String shorten(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= MAX_LENGTH ? s : s.substring(0, MAX_LENGTH - 3) + "...";
    }
}
