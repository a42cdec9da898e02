package org.example.analysis.service.analysis.task;

import org.example.analysis.config.AnalysisProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff. {@code maxAttempts} counts the first call.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public static RetryPolicy from(AnalysisProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff());
    }

    /**
     * Delay before retrying after the given failed attempt (1-based).
     */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
