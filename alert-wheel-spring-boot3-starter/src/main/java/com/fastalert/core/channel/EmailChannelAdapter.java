package com.fastalert.core.channel;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.core.spi.ChannelAdapter;
import com.fastalert.model.DeliveryResult;
import com.fastalert.model.NotificationJob;
import com.fastalert.model.RenderedPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

/**
 * 邮件渠道, 纯文本; 收件人支持逗号分隔多个
 */
@Slf4j
public class EmailChannelAdapter implements ChannelAdapter {

    private final JavaMailSender mailSender;

    private final AlertChannelProperties.Email cfg;

    public EmailChannelAdapter(JavaMailSender mailSender, AlertChannelProperties.Email cfg) {
        this.mailSender = mailSender;
        this.cfg = cfg;
    }

    @Override
    public String channel() {
        return "email";
    }

    @Override
    public boolean isConfigured() {
        return cfg.isEnabled() && cfg.getFrom() != null && !cfg.getFrom().isBlank();
    }

    @Override
    public DeliveryResult send(NotificationJob job) {
        RenderedPayload p = job.getPayload();
        if (p == null || p.getRecipient() == null || p.getRecipient().isBlank()) {
            return DeliveryResult.rejected("no email recipient");
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(cfg.getFrom());
        message.setTo(p.getRecipient().split("\\s*,\\s*"));
        message.setSubject(p.getSubject());
        message.setText(p.getBody());
        try {
            mailSender.send(message);
            return DeliveryResult.sent("email-" + job.getJobId());
        } catch (MailParseException | MailPreparationException | MailAuthenticationException e) {
            // 地址/内容/凭证问题, 重试无意义
            log.warn("[Channel-email] rejected job={}: {}", job.getJobId(), e.getMessage());
            return DeliveryResult.rejected(e.getMessage());
        } catch (MailException e) {
            return DeliveryResult.failed(e.getMessage());
        }
    }
}
