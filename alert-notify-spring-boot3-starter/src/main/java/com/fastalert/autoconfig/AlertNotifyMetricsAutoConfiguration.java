package com.fastalert.autoconfig;

import com.fastalert.core.metric.NotifyMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
public class AlertNotifyMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public NotifyMetrics notifyMetrics(ObjectProvider<MeterRegistry> registries) {
        return NotifyMetrics.create(registries.orderedStream().collect(Collectors.toList()));
    }
}
