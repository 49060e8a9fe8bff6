package com.fastalert.autoconfig;

import com.fastalert.core.metric.AlertMeterRegistryProvider;
import com.fastalert.core.metric.AlertMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
public class AlertMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AlertMeterRegistryProvider alertMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new AlertMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertMetrics alertMetrics(AlertMeterRegistryProvider provider) {
        return AlertMetrics.create(provider.getRegistry());
    }
}
