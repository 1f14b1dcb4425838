package com.whereq.crucible.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Retry policy for failed attempts
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Maximum number of retry attempts, 0 disables retries
     */
    @Builder.Default
    private int maxRetries = 0;

    /**
     * Initial backoff interval in milliseconds
     */
    @Builder.Default
    private long initialIntervalMs = 1000;

    /**
     * Backoff multiplier
     */
    @Builder.Default
    private int backoffMultiplier = 2;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxIntervalMs = 60000;

    public boolean allowsRetry(int attempt) {
        return attempt < maxRetries;
    }

    /**
     * Exponential backoff before the given retry (0-based)
     */
    public Duration backoff(int retry) {
        long backoff = (long) (initialIntervalMs * Math.pow(backoffMultiplier, retry));
        return Duration.ofMillis(Math.min(backoff, maxIntervalMs));
    }
}
