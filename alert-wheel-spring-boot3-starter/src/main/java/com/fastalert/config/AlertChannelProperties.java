package com.fastalert.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 渠道配置, recipient 中的 {team} 会被替换为负责团队
 *
 * alert:
 *   channels:
 *     email:   { enabled: true, from: alerts@example.com, recipient: "{team}@example.com" }
 *     sms:     { enabled: true, endpoint: https://sms.example.com/send, api-key: xxx, recipient: "+15550100" }
 *     webhook: { enabled: true, url: https://hooks.example.com/alerts }
 *     chat:    { enabled: true, webhook-url: https://hooks.slack.com/services/xxx, channel: "#alerts" }
 */
@Data
@ConfigurationProperties(prefix = "alert.channels")
public class AlertChannelProperties {

    private Log log = new Log();

    private Email email = new Email();

    private Sms sms = new Sms();

    private Webhook webhook = new Webhook();

    private Chat chat = new Chat();

    /** 渠道名 -> 收件人模板 */
    public Map<String, String> recipients() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("log", log.getRecipient());
        m.put("email", email.getRecipient());
        m.put("sms", sms.getRecipient());
        m.put("webhook", webhook.getUrl());
        m.put("chat", chat.getChannel());
        return m;
    }

    @Data
    public static class Log {
        private boolean enabled = true;
        private String recipient = "{team}";
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String from = "alerts@localhost";
        private String recipient = "{team}@localhost";
    }

    @Data
    public static class Sms {
        private boolean enabled = false;
        private String endpoint;
        private String apiKey;
        private String recipient;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
        private Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Chat {
        private boolean enabled = false;
        private String webhookUrl;
        private String channel = "#alerts";
        private String username = "alert-wheel";
        private Duration timeout = Duration.ofSeconds(30);
    }
}
