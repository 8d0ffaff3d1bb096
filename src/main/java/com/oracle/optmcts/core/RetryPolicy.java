package com.oracle.optmcts.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.ExponentialBackOff;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Bounded retry settings for one kind of collaborator call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    /**
     * Retries after the first attempt
     */
    @Builder.Default
    private int maxRetries = 2;

    /**
     * Delay before the first retry, 0 to retry immediately
     */
    @Builder.Default
    private long initialBackoffMs = 500;

    @Builder.Default
    private double multiplier = 2.0;

    @Builder.Default
    private long maxBackoffMs = 5000;

    public int maxAttempts() {
        return Math.max(0, maxRetries) + 1;
    }

    public BackOff toBackOff() {
        if (initialBackoffMs <= 0) {
            return new FixedBackOff(0L, Math.max(0, maxRetries));
        }
        ExponentialBackOff backOff = new ExponentialBackOff(initialBackoffMs, Math.max(1.0, multiplier));
        backOff.setMaxInterval(Math.max(initialBackoffMs, maxBackoffMs));
        backOff.setMaxAttempts(Math.max(0, maxRetries));
        return backOff;
    }

    public static RetryPolicy immediate(int maxRetries) {
        return RetryPolicy.builder()
                .maxRetries(maxRetries)
                .initialBackoffMs(0)
                .build();
    }
}
