package dev.mlagents.retry;

import java.time.Duration;
import java.util.Optional;

/** Outcome of consulting a {@link RetryPolicy}: stop, or retry after a delay. */
public record RetryDecision(Optional<Duration> delay) {
    private static final RetryDecision STOP = new RetryDecision(Optional.empty());

    public static RetryDecision stop() {
        return STOP;
    }

    public static RetryDecision after(Duration delay) {
        return new RetryDecision(Optional.of(delay));
    }

    public boolean shouldRetry() {
        return delay.isPresent();
    }
}
