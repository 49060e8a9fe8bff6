package com.fastalert.autoconfig;

import com.fastalert.annotation.EnableAlertWheel;
import com.fastalert.config.AlertWheelProperties;
import com.fastalert.core.AlertPipeline;
import com.fastalert.core.AlertWheelLifecycle;
import com.fastalert.core.backoff.BackoffRegistry;
import com.fastalert.core.channel.ChatChannelAdapter;
import com.fastalert.core.channel.EmailChannelAdapter;
import com.fastalert.core.channel.LoggingChannelAdapter;
import com.fastalert.core.channel.SmsChannelAdapter;
import com.fastalert.core.channel.WebhookChannelAdapter;
import com.fastalert.core.dispatch.BatchDispatcher;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.model.AlertFact;
import com.fastalert.model.enums.Severity;
import com.fastalert.store.AlertStore;
import com.fastalert.store.memory.InMemoryAlertStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AlertWheelAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    AlertMetricsAutoConfiguration.class,
                    AlertGuardAutoConfiguration.class,
                    FailureDeciderAutoConfiguration.class,
                    AlertChannelAutoConfiguration.class,
                    AlertWheelAutoConfiguration.class));

    @Test
    void defaultsWireThePipelineWithLoggingChannel() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(AlertPipeline.class);
            assertThat(ctx).hasSingleBean(AlertWheelLifecycle.class);
            assertThat(ctx).hasSingleBean(FailureDecider.class);
            assertThat(ctx).hasSingleBean(AlertMetrics.class);
            assertThat(ctx).hasSingleBean(LoggingChannelAdapter.class);
            assertThat(ctx).doesNotHaveBean(EmailChannelAdapter.class);
            assertThat(ctx).doesNotHaveBean(SmsChannelAdapter.class);
            assertThat(ctx.getBean(BatchDispatcher.class).adapters()).containsOnlyKeys("log");
            assertThat(ctx.getBean(AlertWheelLifecycle.class).isRunning()).isTrue();

            AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
            String id = pipeline.submitAlertFact(AlertFact.builder().kind("k").severity(Severity.LOW)
                    .title("t").build());
            assertThat(pipeline.getAlert(id).getChannels()).containsExactly("log", "email");
        });
    }

    @Test
    void propertiesBind() {
        runner.withPropertyValues(
                        "alert.dispatch.concurrency=4",
                        "alert.escalation.delays.CRITICAL=5m",
                        "alert.retry.per-channel.sms.max-attempts=5",
                        "alert.guard.circuit-breaker.failure-threshold=7",
                        "alert.routing.default-team=sre")
                .run(ctx -> {
                    AlertWheelProperties props = ctx.getBean(AlertWheelProperties.class);
                    assertThat(props.getDispatch().getConcurrency()).isEqualTo(4);
                    assertThat(props.getEscalation().delayFor(Severity.CRITICAL)).isEqualTo(Duration.ofMinutes(5));
                    assertThat(ctx.getBean(BackoffRegistry.class).policyFor("sms").getMaxAttempts()).isEqualTo(5);
                    assertThat(ctx.getBean(BackoffRegistry.class).policyFor("email").getMaxAttempts()).isEqualTo(3);
                });
    }

    @Test
    void httpChannelsFollowEnableFlags() {
        runner.withPropertyValues(
                        "alert.channels.sms.enabled=true",
                        "alert.channels.sms.endpoint=https://sms.example.com",
                        "alert.channels.sms.api-key=k",
                        "alert.channels.webhook.enabled=true",
                        "alert.channels.log.enabled=false")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(SmsChannelAdapter.class);
                    assertThat(ctx).hasSingleBean(WebhookChannelAdapter.class);
                    assertThat(ctx).doesNotHaveBean(ChatChannelAdapter.class);
                    assertThat(ctx).doesNotHaveBean(LoggingChannelAdapter.class);
                    AlertPipeline pipeline = ctx.getBean(AlertPipeline.class);
                    // webhook 未配置 url
                    assertThat(pipeline.validateChannels())
                            .containsEntry("sms", true)
                            .containsEntry("webhook", false);
                });
    }

    @Test
    void emailNeedsMailSenderBean() {
        runner.withPropertyValues("alert.channels.email.enabled=true")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(EmailChannelAdapter.class));

        runner.withPropertyValues("alert.channels.email.enabled=true")
                .withBean(JavaMailSender.class, () -> mock(JavaMailSender.class))
                .run(ctx -> assertThat(ctx).hasSingleBean(EmailChannelAdapter.class));
    }

    @Test
    void userStoreReplacesInMemory() {
        runner.withUserConfiguration(CustomStoreConfig.class)
                .run(ctx -> assertThat(ctx.getBean(AlertStore.class)).isSameAs(CustomStoreConfig.STORE));
    }

    @Test
    void enableAnnotationCanSwitchOff() {
        runner.withUserConfiguration(DisabledConfig.class)
                .run(ctx -> {
                    assertThat(ctx.getBean(AlertWheelProperties.class).isEnabled()).isFalse();
                    assertThat(ctx.getBean(AlertWheelLifecycle.class).isRunning()).isFalse();
                });
    }

    @Test
    void invalidThresholdFailsStartup() {
        runner.withPropertyValues("alert.guard.circuit-breaker.failure-threshold=0")
                .run(ctx -> assertThat(ctx).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfig {

        static final InMemoryAlertStore STORE = new InMemoryAlertStore();

        @Bean
        AlertStore customAlertStore() {
            return STORE;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @EnableAlertWheel(false)
    static class DisabledConfig {
    }
}
