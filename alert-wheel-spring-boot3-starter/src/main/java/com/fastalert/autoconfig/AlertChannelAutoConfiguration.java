package com.fastalert.autoconfig;

import com.fastalert.config.AlertChannelProperties;
import com.fastalert.core.channel.AbstractHttpChannelAdapter;
import com.fastalert.core.channel.ChatChannelAdapter;
import com.fastalert.core.channel.DefaultPayloadRenderer;
import com.fastalert.core.channel.EmailChannelAdapter;
import com.fastalert.core.channel.LoggingChannelAdapter;
import com.fastalert.core.channel.SmsChannelAdapter;
import com.fastalert.core.channel.WebhookChannelAdapter;
import com.fastalert.core.serializer.JacksonPayloadSerializer;
import com.fastalert.core.spi.PayloadRenderer;
import com.fastalert.core.spi.PayloadSerializer;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.web.client.RestTemplate;

/**
 * 渠道装配, 各渠道通过 alert.channels.{name}.enabled 开关
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration")
@EnableConfigurationProperties(AlertChannelProperties.class)
public class AlertChannelAutoConfiguration {

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 默认纯文本渲染
     */
    @Bean
    @ConditionalOnMissingBean(PayloadRenderer.class)
    public PayloadRenderer payloadRenderer(AlertChannelProperties props) {
        return new DefaultPayloadRenderer(props);
    }

    @Bean
    @ConditionalOnMissingBean(name = "loggingChannelAdapter")
    @ConditionalOnProperty(prefix = "alert.channels.log", name = "enabled", matchIfMissing = true)
    public LoggingChannelAdapter loggingChannelAdapter() {
        return new LoggingChannelAdapter();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JavaMailSender.class)
    @ConditionalOnBean(JavaMailSender.class)
    @ConditionalOnProperty(prefix = "alert.channels.email", name = "enabled")
    static class EmailChannelConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "emailChannelAdapter")
        public EmailChannelAdapter emailChannelAdapter(JavaMailSender mailSender, AlertChannelProperties props) {
            return new EmailChannelAdapter(mailSender, props.getEmail());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RestTemplate.class)
    static class HttpChannelConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "smsChannelAdapter")
        @ConditionalOnProperty(prefix = "alert.channels.sms", name = "enabled")
        public SmsChannelAdapter smsChannelAdapter(PayloadSerializer serializer, AlertChannelProperties props) {
            AlertChannelProperties.Sms cfg = props.getSms();
            return new SmsChannelAdapter(AbstractHttpChannelAdapter.restTemplate(cfg.getTimeout()), serializer, cfg);
        }

        @Bean
        @ConditionalOnMissingBean(name = "webhookChannelAdapter")
        @ConditionalOnProperty(prefix = "alert.channels.webhook", name = "enabled")
        public WebhookChannelAdapter webhookChannelAdapter(PayloadSerializer serializer, AlertChannelProperties props) {
            AlertChannelProperties.Webhook cfg = props.getWebhook();
            return new WebhookChannelAdapter(AbstractHttpChannelAdapter.restTemplate(cfg.getTimeout()), serializer, cfg);
        }

        @Bean
        @ConditionalOnMissingBean(name = "chatChannelAdapter")
        @ConditionalOnProperty(prefix = "alert.channels.chat", name = "enabled")
        public ChatChannelAdapter chatChannelAdapter(PayloadSerializer serializer, AlertChannelProperties props) {
            AlertChannelProperties.Chat cfg = props.getChat();
            return new ChatChannelAdapter(AbstractHttpChannelAdapter.restTemplate(cfg.getTimeout()), serializer, cfg);
        }
    }
}
