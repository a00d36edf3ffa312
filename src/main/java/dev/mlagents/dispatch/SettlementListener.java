package dev.mlagents.dispatch;

import dev.mlagents.benchmark.Question;
import dev.mlagents.failure.FailureReason;
import java.time.Duration;

/**
 * Callbacks from the {@link DispatchPool}, invoked on pool threads. An exception thrown from
 * either method completes the question's future exceptionally and stops further attempts.
 */
public interface SettlementListener {
    /** An attempt failed and another one is scheduled after {@code delay}. */
    default void onRetryScheduled(
            Question question, int attempt, FailureReason reason, String details, Duration delay) {}

    /**
     * The question succeeded or failed for good. Called before the future completes, so anything
     * persisted here is visible to whoever waits on it. Not called for abandoned questions.
     */
    void onSettled(Question question, Settlement settlement);
}
