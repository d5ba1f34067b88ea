package com.fiftyalert.dispatcher.domain.policy;

import lombok.Builder;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunables of one dispatch run. Defaults:
 * <ul>
 *   <li>{@code retryCeiling} 3 transport attempts per recipient</li>
 *   <li>{@code backoffBase} 1s, delay before retry n is {@code backoffBase * 2^n}, capped at {@code backoffMax} 30s</li>
 *   <li>{@code successThreshold} 0.95 effective delivery rate required to commit</li>
 *   <li>{@code freshnessWindowDays} 1, events older than today minus this are stale</li>
 *   <li>{@code seasonStartMonth} 10 (October), {@code zone} America/New_York</li>
 *   <li>{@code maxConcurrency} 4 recipients in flight, pacing pause of 1s every 10 submissions</li>
 *   <li>{@code attemptTimeout} 30s per transport call</li>
 * </ul>
 */
@Builder(toBuilder = true)
public record DispatchPolicy(
        int retryCeiling,
        Duration backoffBase,
        Duration backoffMax,
        double successThreshold,
        int freshnessWindowDays,
        int seasonStartMonth,
        ZoneId zone,
        int maxConcurrency,
        int pacingEvery,
        Duration pacingPause,
        Duration attemptTimeout
) {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/New_York");

    public DispatchPolicy {
        if (retryCeiling < 1) {
            throw new IllegalArgumentException("retryCeiling must be >= 1, got: " + retryCeiling);
        }
        if (successThreshold < 0.0 || successThreshold > 1.0) {
            throw new IllegalArgumentException("successThreshold must be within [0, 1], got: " + successThreshold);
        }
        if (freshnessWindowDays < 0) {
            throw new IllegalArgumentException("freshnessWindowDays must be >= 0, got: " + freshnessWindowDays);
        }
        if (seasonStartMonth < 1 || seasonStartMonth > 12) {
            throw new IllegalArgumentException("seasonStartMonth must be within [1, 12], got: " + seasonStartMonth);
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1, got: " + maxConcurrency);
        }
        if (pacingEvery < 0) {
            throw new IllegalArgumentException("pacingEvery must be >= 0, got: " + pacingEvery);
        }
        if (backoffBase == null || backoffMax == null || pacingPause == null || attemptTimeout == null || zone == null) {
            throw new IllegalArgumentException("durations and zone are required");
        }
    }

    public static DispatchPolicy defaults() {
        return DispatchPolicy.builder()
                .retryCeiling(3)
                .backoffBase(Duration.ofSeconds(1))
                .backoffMax(Duration.ofSeconds(30))
                .successThreshold(0.95)
                .freshnessWindowDays(1)
                .seasonStartMonth(10)
                .zone(DEFAULT_ZONE)
                .maxConcurrency(4)
                .pacingEvery(10)
                .pacingPause(Duration.ofSeconds(1))
                .attemptTimeout(Duration.ofSeconds(30))
                .build();
    }
}
