package dev.mlagents.dispatch;

import dev.mlagents.agent.Answer;
import dev.mlagents.failure.FailureReason;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Final outcome of dispatching one question.
 *
 * @param answer parsed answer, set when succeeded
 * @param failureReason classification of the last failure, set when failed
 * @param details message of the last failure
 * @param attempts attempts made
 * @param elapsed wall time from first admission to settlement
 */
public record Settlement(
        String questionId,
        Status status,
        @Nullable Answer answer,
        Optional<FailureReason> failureReason,
        @Nullable String details,
        int attempts,
        Duration elapsed) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        /** Dropped after {@link DispatchPool#stopAccepting()}; nothing should be persisted. */
        ABANDONED
    }

    static Settlement succeeded(String questionId, Answer answer, int attempts, Duration elapsed) {
        return new Settlement(
                questionId, Status.SUCCEEDED, answer, Optional.empty(), null, attempts, elapsed);
    }

    static Settlement failed(
            String questionId,
            FailureReason reason,
            @Nullable String details,
            int attempts,
            Duration elapsed) {
        return new Settlement(
                questionId, Status.FAILED, null, Optional.of(reason), details, attempts, elapsed);
    }

    static Settlement abandoned(String questionId, int attempts, Duration elapsed) {
        return new Settlement(
                questionId, Status.ABANDONED, null, Optional.empty(), null, attempts, elapsed);
    }
}
