package dev.mlagents.eval;

import dev.mlagents.failure.FailureReason;
import java.util.Optional;
import javax.annotation.Nullable;

/** Per-question line of an {@link EvaluationResults} aggregate. */
public record QuestionJudgment(
        String questionId,
        String expectedAnswer,
        @Nullable String actualAnswer,
        ResultStatus status,
        boolean correct,
        Optional<FailureReason> failureReason) {}
