package dev.mlagents.eval;

import dev.mlagents.failure.FailureReason;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of an evaluation's progress, readable at any point of its lifecycle.
 *
 * @param retrying questions with a stored result that is not yet terminal
 * @param notStarted questions without any stored result
 * @param correct succeeded questions judged correct so far
 * @param executionTime time from first start to completion, once both are known
 */
public record EvaluationStatus(
        String evaluationId,
        EvaluationState state,
        int totalQuestions,
        int succeeded,
        int failed,
        Map<FailureReason, Integer> failedByReason,
        int retrying,
        int notStarted,
        int correct,
        Optional<String> failureSummary,
        Optional<EvaluationResults> results,
        Optional<Duration> executionTime) {

    public EvaluationStatus {
        failedByReason = Map.copyOf(failedByReason);
    }

    public int settled() {
        return succeeded + failed;
    }
}
