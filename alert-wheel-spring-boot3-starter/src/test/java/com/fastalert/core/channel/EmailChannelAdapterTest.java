package com.fastalert.core.channel;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import com.fastalert.model.enums.NotificationReason;
import com.fastalert.model.enums.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;

@ExtendWith(MockitoExtension.class)
class EmailChannelAdapterTest {

    @Mock
    private JavaMailSender mailSender;

    private AlertChannelProperties.Email cfg;

    private EmailChannelAdapter adapter;

    @BeforeEach
    void setUp() {
        cfg = new AlertChannelProperties.Email();
        cfg.setEnabled(true);
        cfg.setFrom("alerts@example.com");
        adapter = new EmailChannelAdapter(mailSender, cfg);
    }

    private static NotificationJob job(String recipient) {
        return NotificationJob.builder()
                .jobId("j-1")
                .alertId("a-1")
                .channel("email")
                .payload(RenderedPayload.builder().channel("email").recipient(recipient)
                        .subject("[HIGH] disk full").body("details").build())
                .attempt(1)
                .maxAttempts(3)
                .reason(NotificationReason.CREATED)
                .severity(Severity.HIGH)
                .build();
    }

    @Test
    void sendsPlainTextToEveryRecipient() {
        DeliveryResult r = adapter.send(job("ops@example.com, sre@example.com"));

        ArgumentCaptor<SimpleMailMessage> captor = ArgumentCaptor.forClass(SimpleMailMessage.class);
        then(mailSender).should().send(captor.capture());
        SimpleMailMessage m = captor.getValue();
        assertThat(m.getFrom()).isEqualTo("alerts@example.com");
        assertThat(m.getTo()).containsExactly("ops@example.com", "sre@example.com");
        assertThat(m.getSubject()).isEqualTo("[HIGH] disk full");
        assertThat(r.isSent()).isTrue();
        assertThat(r.getProviderRef()).isEqualTo("email-j-1");
    }

    @Test
    void parseErrorIsRejected() {
        willThrow(new MailParseException("bad address")).given(mailSender).send(any(SimpleMailMessage.class));

        DeliveryResult r = adapter.send(job("not an address"));

        assertThat(r.isSent()).isFalse();
        assertThat(r.isRetryable()).isFalse();
    }

    @Test
    void sendErrorIsRetryable() {
        willThrow(new MailSendException("smtp down")).given(mailSender).send(any(SimpleMailMessage.class));

        DeliveryResult r = adapter.send(job("ops@example.com"));

        assertThat(r.isRetryable()).isTrue();
        assertThat(r.getError()).contains("smtp down");
    }

    @Test
    void missingRecipientOrSenderConfig() {
        assertThat(adapter.send(job(" ")).isRetryable()).isFalse();
        then(mailSender).should(never()).send(any(SimpleMailMessage.class));

        cfg.setFrom("");
        assertThat(adapter.isConfigured()).isFalse();
    }
}
