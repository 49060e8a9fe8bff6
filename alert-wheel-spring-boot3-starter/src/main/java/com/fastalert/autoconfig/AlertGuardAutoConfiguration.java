package com.fastalert.autoconfig;

import com.fastalert.config.AlertGuardProperties;
import com.fastalert.core.guard.ChannelHealthTracker;
import com.fastalert.core.metric.AlertMetrics;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = AlertMetricsAutoConfiguration.class)
@EnableConfigurationProperties({
        AlertGuardProperties.class
})
public class AlertGuardAutoConfiguration {

    /**
     * 渠道熔断
     */
    @Bean
    @ConditionalOnMissingBean
    public ChannelHealthTracker channelHealthTracker(AlertGuardProperties props, AlertMetrics metrics) {
        if (props.getCircuitBreaker().getFailureThreshold() < 1) {
            throw new IllegalArgumentException("alert.guard.circuit-breaker.failure-threshold must be >= 1");
        }
        return new ChannelHealthTracker(props, metrics);
    }
}
