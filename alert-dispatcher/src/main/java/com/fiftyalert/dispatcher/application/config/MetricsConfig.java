package com.fiftyalert.dispatcher.application.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Counter recipientsDeliveredCounter(MeterRegistry registry) {
        return Counter.builder("dispatch.recipients.delivered")
                .description("Recipients that accepted the notification")
                .register(registry);
    }

    @Bean
    public Counter recipientsAlreadyDeliveredCounter(MeterRegistry registry) {
        return Counter.builder("dispatch.recipients.already_delivered")
                .description("Recipients that already had the notification")
                .register(registry);
    }

    @Bean
    public Counter recipientsFailedCounter(MeterRegistry registry) {
        return Counter.builder("dispatch.recipients.failed")
                .description("Recipients that could not be reached after retries")
                .register(registry);
    }
}
