package dev.mlagents.retry;

import dev.mlagents.config.MlAgentsConfig;
import dev.mlagents.failure.FailureReason;
import java.time.Duration;

/**
 * Exponential back-off: {@code min(baseDelay * 2^(attempt-1), maxDelay)}. Retryable reasons get
 * {@code maxAttempts} attempts in total, malformed responses {@code malformedMaxAttempts}, and
 * authentication or configuration problems are never retried.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final int malformedMaxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public ExponentialBackoffRetryPolicy(
            int maxAttempts, int malformedMaxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1 || malformedMaxAttempts < 1) {
            throw new IllegalArgumentException("attempt limits must be at least 1");
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("invalid delays: " + baseDelay + ", " + maxDelay);
        }
        this.maxAttempts = maxAttempts;
        this.malformedMaxAttempts = malformedMaxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static ExponentialBackoffRetryPolicy fromConfig(MlAgentsConfig config) {
        return new ExponentialBackoffRetryPolicy(
                config.maxAttempts(),
                config.malformedMaxAttempts(),
                config.retryBaseDelay(),
                config.retryMaxDelay());
    }

    @Override
    public RetryDecision decide(FailureReason reason, int attempt) {
        var limit =
                switch (reason) {
                    case TRANSIENT_NETWORK, RATE_LIMITED, TIMEOUT, UNKNOWN -> maxAttempts;
                    case MALFORMED_RESPONSE -> malformedMaxAttempts;
                    case AUTHENTICATION, INVALID_CONFIGURATION -> 0;
                };
        if (attempt >= limit) {
            return RetryDecision.stop();
        }
        return RetryDecision.after(delayFor(attempt));
    }

    Duration delayFor(int attempt) {
        // cap the shift so large attempt counts cannot overflow
        var factor = 1L << Math.min(attempt - 1, 30);
        var millis = baseDelay.toMillis() * factor;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }
}
