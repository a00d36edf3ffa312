package dev.mlagents.eval;

import dev.mlagents.failure.FailureReason;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a completed evaluation. Failed questions are excluded from accuracy rather than
 * counted as wrong, so {@code accuracy = correct / succeeded}.
 */
public record EvaluationResults(
        int total,
        int succeeded,
        int failed,
        Map<FailureReason, Integer> failedByReason,
        int correct,
        double accuracy,
        List<QuestionJudgment> judgments) {

    public EvaluationResults {
        if (succeeded + failed != total) {
            throw new IllegalArgumentException(
                    "succeeded (%d) + failed (%d) != total (%d)"
                            .formatted(succeeded, failed, total));
        }
        if (correct > succeeded) {
            throw new IllegalArgumentException(
                    "correct (%d) > succeeded (%d)".formatted(correct, succeeded));
        }
        failedByReason =
                failedByReason.isEmpty()
                        ? Map.of()
                        : Map.copyOf(new EnumMap<>(failedByReason));
        judgments = List.copyOf(judgments);
    }

    /** Accuracy as a percentage, rounded to two decimals. */
    public double accuracyPercent() {
        return Math.round(accuracy * 10_000.0) / 100.0;
    }
}
