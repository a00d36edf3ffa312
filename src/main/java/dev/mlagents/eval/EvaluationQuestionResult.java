package dev.mlagents.eval;

import dev.mlagents.failure.FailureReason;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Durable outcome of one question within one evaluation, keyed by {@code (evaluationId,
 * questionId)}. A result without a status is still being retried; once the status is set the
 * record is frozen.
 *
 * @param answer produced answer, set only when succeeded
 * @param reasoning reasoning trace that came with the answer, if any
 * @param correct correctness judgment, set only when succeeded
 * @param status terminal status, empty while retrying
 * @param failureReason reason of the last failed attempt; the final reason when status is failed
 * @param attempts attempts made in the run that wrote this record
 * @param failureDetails provider or parser message for the last failure
 */
public record EvaluationQuestionResult(
        @Nonnull String evaluationId,
        @Nonnull String questionId,
        @Nullable String answer,
        @Nonnull Optional<String> reasoning,
        @Nullable Boolean correct,
        @Nonnull Optional<ResultStatus> status,
        @Nonnull Optional<FailureReason> failureReason,
        int attempts,
        @Nullable String failureDetails,
        @Nonnull Instant updatedAt) {

    public EvaluationQuestionResult {
        Objects.requireNonNull(evaluationId);
        Objects.requireNonNull(questionId);
        Objects.requireNonNull(reasoning);
        Objects.requireNonNull(status);
        Objects.requireNonNull(failureReason);
        Objects.requireNonNull(updatedAt);
        if (status.filter(s -> s == ResultStatus.FAILED).isPresent() && failureReason.isEmpty()) {
            throw new IllegalArgumentException("failed result requires a failure reason");
        }
        if (status.filter(s -> s == ResultStatus.SUCCEEDED).isPresent() && answer == null) {
            throw new IllegalArgumentException("succeeded result requires an answer");
        }
    }

    /** A question whose last attempt failed and which is waiting to be retried. */
    public static EvaluationQuestionResult retrying(
            String evaluationId,
            String questionId,
            FailureReason lastFailure,
            @Nullable String details,
            int attempts,
            Instant at) {
        return new EvaluationQuestionResult(
                evaluationId,
                questionId,
                null,
                Optional.empty(),
                null,
                Optional.empty(),
                Optional.of(lastFailure),
                attempts,
                details,
                at);
    }

    public static EvaluationQuestionResult succeeded(
            String evaluationId,
            String questionId,
            String answer,
            Optional<String> reasoning,
            boolean correct,
            int attempts,
            Instant at) {
        return new EvaluationQuestionResult(
                evaluationId,
                questionId,
                answer,
                reasoning,
                correct,
                Optional.of(ResultStatus.SUCCEEDED),
                Optional.empty(),
                attempts,
                null,
                at);
    }

    public static EvaluationQuestionResult failed(
            String evaluationId,
            String questionId,
            FailureReason reason,
            @Nullable String details,
            int attempts,
            Instant at) {
        return new EvaluationQuestionResult(
                evaluationId,
                questionId,
                null,
                Optional.empty(),
                null,
                Optional.of(ResultStatus.FAILED),
                Optional.of(reason),
                attempts,
                details,
                at);
    }

    public boolean isTerminal() {
        return status.isPresent();
    }

    public boolean isSucceeded() {
        return status.filter(s -> s == ResultStatus.SUCCEEDED).isPresent();
    }

    public boolean isFailed() {
        return status.filter(s -> s == ResultStatus.FAILED).isPresent();
    }

    public boolean isCorrect() {
        return Boolean.TRUE.equals(correct);
    }
}
