package com.fastalert.core.channel;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.core.serializer.JacksonPayloadSerializer;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import com.fastalert.model.enums.NotificationReason;
import com.fastalert.model.enums.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpChannelAdapterTest {

    private RestTemplate restTemplate;

    private MockRestServiceServer server;

    private final JacksonPayloadSerializer serializer = new JacksonPayloadSerializer();

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private static NotificationJob job(String channel, String recipient, String subject) {
        return NotificationJob.builder()
                .jobId("j-1")
                .alertId("a-1")
                .channel(channel)
                .payload(RenderedPayload.builder().channel(channel).recipient(recipient)
                        .subject(subject).body("details").build())
                .attempt(1)
                .maxAttempts(3)
                .reason(NotificationReason.CREATED)
                .severity(Severity.CRITICAL)
                .build();
    }

    private WebhookChannelAdapter webhook() {
        AlertChannelProperties.Webhook cfg = new AlertChannelProperties.Webhook();
        cfg.setEnabled(true);
        cfg.setUrl("https://hooks.example.com/alerts");
        cfg.setHeaders(Map.of("X-Token", "secret"));
        return new WebhookChannelAdapter(restTemplate, serializer, cfg);
    }

    @Test
    void webhookPostsJsonAndUsesRequestIdAsRef() {
        HttpHeaders respHeaders = new HttpHeaders();
        respHeaders.set("X-Request-Id", "req-77");
        server.expect(requestTo("https://hooks.example.com/alerts"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Token", "secret"))
                .andExpect(jsonPath("$.alertId").value("a-1"))
                .andExpect(jsonPath("$.severity").value("CRITICAL"))
                .andExpect(jsonPath("$.subject").value("[CRITICAL] db down"))
                .andRespond(withSuccess().headers(respHeaders));

        DeliveryResult r = webhook().send(job("webhook", "ops", "[CRITICAL] db down"));

        assertThat(r.isSent()).isTrue();
        assertThat(r.getProviderRef()).isEqualTo("req-77");
        server.verify();
    }

    @Test
    void clientErrorIsRejectedButThrottleIsRetryable() {
        server.expect(requestTo("https://hooks.example.com/alerts"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST).body("bad payload"));
        server.expect(requestTo("https://hooks.example.com/alerts"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        WebhookChannelAdapter adapter = webhook();

        DeliveryResult bad = adapter.send(job("webhook", "ops", "s"));
        DeliveryResult throttled = adapter.send(job("webhook", "ops", "s"));

        assertThat(bad.isSent()).isFalse();
        assertThat(bad.isRetryable()).isFalse();
        assertThat(bad.getError()).contains("400").contains("bad payload");
        assertThat(throttled.isRetryable()).isTrue();
    }

    @Test
    void serverErrorAndIoErrorAreRetryable() {
        server.expect(requestTo("https://hooks.example.com/alerts"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));
        server.expect(requestTo("https://hooks.example.com/alerts"))
                .andRespond(withException(new IOException("connection reset")));
        WebhookChannelAdapter adapter = webhook();

        assertThat(adapter.send(job("webhook", "ops", "s")).isRetryable()).isTrue();
        DeliveryResult io = adapter.send(job("webhook", "ops", "s"));
        assertThat(io.isRetryable()).isTrue();
        assertThat(io.getError()).contains("I/O error");
    }

    @Test
    void webhookWithoutUrlIsNotConfigured() {
        AlertChannelProperties.Webhook cfg = new AlertChannelProperties.Webhook();
        cfg.setEnabled(true);

        assertThat(new WebhookChannelAdapter(restTemplate, serializer, cfg).isConfigured()).isFalse();
    }

    private SmsChannelAdapter sms() {
        AlertChannelProperties.Sms cfg = new AlertChannelProperties.Sms();
        cfg.setEnabled(true);
        cfg.setEndpoint("https://sms.example.com/send");
        cfg.setApiKey("k-123");
        return new SmsChannelAdapter(restTemplate, serializer, cfg);
    }

    @Test
    void smsSendsBearerAndShortMessage() {
        String longSubject = "x".repeat(300);
        server.expect(requestTo("https://sms.example.com/send"))
                .andExpect(header("Authorization", "Bearer k-123"))
                .andExpect(jsonPath("$.to").value("+15550001"))
                .andExpect(jsonPath("$.reference").value("j-1"))
                .andExpect(jsonPath("$.message").value(SmsChannelAdapter.shorten(longSubject)))
                .andRespond(withSuccess("{\"messageId\":\"m-9\"}", MediaType.APPLICATION_JSON));

        DeliveryResult r = sms().send(job("sms", "+15550001", longSubject));

        assertThat(r.isSent()).isTrue();
        assertThat(r.getProviderRef()).isEqualTo("m-9");
        assertThat(SmsChannelAdapter.shorten(longSubject)).hasSize(160).endsWith("...");
        server.verify();
    }

    @Test
    void smsWithoutRecipientIsRejectedWithoutCall() {
        DeliveryResult r = sms().send(job("sms", "", "s"));

        assertThat(r.isSent()).isFalse();
        assertThat(r.isRetryable()).isFalse();
        server.verify();
    }

    @Test
    void chatPostsColoredAttachment() {
        AlertChannelProperties.Chat cfg = new AlertChannelProperties.Chat();
        cfg.setEnabled(true);
        cfg.setWebhookUrl("https://chat.example.com/hook");
        server.expect(requestTo("https://chat.example.com/hook"))
                .andExpect(jsonPath("$.channel").value("#oncall"))
                .andExpect(jsonPath("$.username").value("alert-wheel"))
                .andExpect(jsonPath("$.attachments[0].color").value("#d9534f"))
                .andExpect(jsonPath("$.attachments[0].title").value("[CRITICAL] db down"))
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        DeliveryResult r = new ChatChannelAdapter(restTemplate, serializer, cfg)
                .send(job("chat", "#oncall", "[CRITICAL] db down"));

        assertThat(r.isSent()).isTrue();
        assertThat(r.getProviderRef()).isEqualTo("chat-j-1");
        server.verify();
    }
}
