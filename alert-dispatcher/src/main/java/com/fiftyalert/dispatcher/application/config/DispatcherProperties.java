package com.fiftyalert.dispatcher.application.config;

import com.fiftyalert.dispatcher.domain.policy.DispatchPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

@Validated
@ConfigurationProperties(prefix = "dispatcher")
public record DispatcherProperties(
        @NotNull @Valid Storage storage,
        @NotNull @Valid Policy policy,
        @NotNull @Valid EmailOctopus emailOctopus
) {

    public record Storage(@NotBlank String clubData, @NotBlank String ledger) {

        public Path clubDataPath() {
            return Path.of(clubData);
        }

        public Path ledgerPath() {
            return Path.of(ledger);
        }
    }

    public record Policy(
            @Min(1) int retryCeiling,
            @NotNull Duration backoffBase,
            @NotNull Duration backoffMax,
            @DecimalMin("0.0") @DecimalMax("1.0") double successThreshold,
            @Min(0) int freshnessWindowDays,
            @Min(1) @Max(12) int seasonStartMonth,
            @NotBlank String zone,
            @Min(1) int maxConcurrency,
            @Min(0) int pacingEvery,
            @NotNull Duration pacingPause,
            @NotNull Duration attemptTimeout
    ) {

        public DispatchPolicy toDispatchPolicy() {
            return DispatchPolicy.builder()
                    .retryCeiling(retryCeiling)
                    .backoffBase(backoffBase)
                    .backoffMax(backoffMax)
                    .successThreshold(successThreshold)
                    .freshnessWindowDays(freshnessWindowDays)
                    .seasonStartMonth(seasonStartMonth)
                    .zone(ZoneId.of(zone))
                    .maxConcurrency(maxConcurrency)
                    .pacingEvery(pacingEvery)
                    .pacingPause(pacingPause)
                    .attemptTimeout(attemptTimeout)
                    .build();
        }
    }

    /**
     * EmailOctopus API v1.6 access. {@code apiKey}, {@code listId} and {@code automationId}
     * normally come from the environment.
     */
    public record EmailOctopus(
            @NotBlank String baseUrl,
            @NotBlank String apiKey,
            @NotBlank String listId,
            @NotBlank String automationId,
            @Min(1) @Max(100) int pageSize,
            @Min(1) int maxPages,
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout
    ) {}
}
