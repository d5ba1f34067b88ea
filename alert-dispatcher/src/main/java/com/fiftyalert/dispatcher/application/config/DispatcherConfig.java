package com.fiftyalert.dispatcher.application.config;

import com.fiftyalert.common.json.JacksonConfig;
import com.fiftyalert.dispatcher.domain.dispatch.ExponentialBackoffRetryPolicy;
import com.fiftyalert.dispatcher.domain.dispatch.NotificationTransport;
import com.fiftyalert.dispatcher.domain.dispatch.RetryPolicy;
import com.fiftyalert.dispatcher.domain.event.ScoringEventSource;
import com.fiftyalert.dispatcher.domain.ledger.DeliveryLedger;
import com.fiftyalert.dispatcher.domain.policy.DispatchPolicy;
import com.fiftyalert.dispatcher.domain.recipient.RecipientSource;
import com.fiftyalert.dispatcher.infrastructure.emailoctopus.EmailOctopusErrorMapper;
import com.fiftyalert.dispatcher.infrastructure.emailoctopus.EmailOctopusRecipientSource;
import com.fiftyalert.dispatcher.infrastructure.emailoctopus.EmailOctopusTransport;
import com.fiftyalert.dispatcher.infrastructure.file.ClubDataEventSource;
import com.fiftyalert.dispatcher.infrastructure.file.JsonFileDeliveryLedger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestClient;
import tools.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JacksonConfig.createObjectMapper();
    }

    @Bean
    public DispatchPolicy dispatchPolicy(DispatcherProperties properties) {
        return properties.policy().toDispatchPolicy();
    }

    @Bean
    public RetryPolicy retryPolicy(DispatchPolicy policy) {
        return new ExponentialBackoffRetryPolicy(policy.backoffBase().toMillis(), policy.backoffMax().toMillis());
    }

    /**
     * Runs transport attempts and delayed retries. Sized to the concurrency bound of a session.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor(DispatchPolicy policy) {
        return Executors.newFixedThreadPool(policy.maxConcurrency(), new CustomizableThreadFactory("dispatch-"));
    }

    @Bean
    public ScoringEventSource scoringEventSource(DispatcherProperties properties, ObjectMapper objectMapper) {
        return new ClubDataEventSource(properties.storage().clubDataPath(), objectMapper);
    }

    @Bean
    public DeliveryLedger deliveryLedger(DispatcherProperties properties, Clock clock) {
        return new JsonFileDeliveryLedger(
                properties.storage().ledgerPath(), JacksonConfig.createPrettyPrintingObjectMapper(), clock);
    }

    @Bean
    public RestClient emailOctopusRestClient(DispatcherProperties properties) {
        var emailOctopus = properties.emailOctopus();
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(emailOctopus.connectTimeout())
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(emailOctopus.readTimeout());
        return RestClient.builder()
                .baseUrl(emailOctopus.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public RecipientSource recipientSource(
            RestClient emailOctopusRestClient, ObjectMapper objectMapper, DispatcherProperties properties) {
        return new EmailOctopusRecipientSource(emailOctopusRestClient, objectMapper, properties.emailOctopus());
    }

    @Bean
    public NotificationTransport notificationTransport(
            RestClient emailOctopusRestClient, ObjectMapper objectMapper, DispatcherProperties properties) {
        return new EmailOctopusTransport(
                emailOctopusRestClient, objectMapper, new EmailOctopusErrorMapper(objectMapper), properties.emailOctopus());
    }
}
