package dev.mlagents.retry;

import dev.mlagents.failure.FailureReason;

/** Decides whether a failed attempt is retried. Implementations must be pure. */
public interface RetryPolicy {
    /**
     * @param reason classification of the failed attempt
     * @param attempt number of attempts made so far, starting at 1
     */
    RetryDecision decide(FailureReason reason, int attempt);
}
