package dev.mlagents.eval;

import dev.mlagents.agent.AgentConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * One run of an agent configuration over a benchmark. Immutable; every transition returns a new
 * value and rejects moves the lifecycle does not allow.
 */
public record Evaluation(
        @Nonnull String id,
        @Nonnull String benchmarkId,
        @Nonnull AgentConfig agentConfig,
        @Nonnull EvaluationState state,
        @Nonnull Instant createdAt,
        @Nonnull Optional<Instant> startedAt,
        @Nonnull Optional<Instant> completedAt,
        @Nonnull Optional<String> failureSummary,
        @Nonnull Optional<EvaluationResults> results) {

    public Evaluation {
        Objects.requireNonNull(id);
        Objects.requireNonNull(benchmarkId);
        Objects.requireNonNull(agentConfig);
        Objects.requireNonNull(state);
        Objects.requireNonNull(createdAt);
        Objects.requireNonNull(startedAt);
        Objects.requireNonNull(completedAt);
        Objects.requireNonNull(failureSummary);
        Objects.requireNonNull(results);
    }

    public static Evaluation create(
            String id, String benchmarkId, AgentConfig agentConfig, Instant createdAt) {
        return new Evaluation(
                id,
                benchmarkId,
                agentConfig,
                EvaluationState.PENDING,
                createdAt,
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                Optional.empty());
    }

    /**
     * Moves to running. Allowed from pending, from cancelled (resume) and from running (an earlier
     * process died mid-run). The first start time is kept.
     */
    public Evaluation start(Instant at) {
        requireState(
                "start",
                EvaluationState.PENDING,
                EvaluationState.RUNNING,
                EvaluationState.CANCELLED);
        return new Evaluation(
                id,
                benchmarkId,
                agentConfig,
                EvaluationState.RUNNING,
                createdAt,
                startedAt.or(() -> Optional.of(at)),
                Optional.empty(),
                Optional.empty(),
                Optional.empty());
    }

    public Evaluation complete(EvaluationResults evaluationResults, Instant at) {
        requireState("complete", EvaluationState.RUNNING);
        return new Evaluation(
                id,
                benchmarkId,
                agentConfig,
                EvaluationState.COMPLETED,
                createdAt,
                startedAt,
                Optional.of(at),
                Optional.empty(),
                Optional.of(evaluationResults));
    }

    public Evaluation fail(String summary, Instant at) {
        requireState(
                "fail",
                EvaluationState.PENDING,
                EvaluationState.RUNNING,
                EvaluationState.CANCELLED);
        return new Evaluation(
                id,
                benchmarkId,
                agentConfig,
                EvaluationState.ERRORED,
                createdAt,
                startedAt,
                Optional.of(at),
                Optional.of(summary),
                Optional.empty());
    }

    public Evaluation cancel(Instant at) {
        requireState("cancel", EvaluationState.RUNNING);
        return new Evaluation(
                id,
                benchmarkId,
                agentConfig,
                EvaluationState.CANCELLED,
                createdAt,
                startedAt,
                Optional.of(at),
                Optional.empty(),
                Optional.empty());
    }

    /** Time from the first start to completion; empty until the evaluation has both. */
    public Optional<Duration> executionTime() {
        return startedAt.flatMap(
                start -> completedAt.map(end -> Duration.between(start, end)));
    }

    private void requireState(String transition, EvaluationState... allowed) {
        for (var candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new InvalidEvaluationStateException(
                "cannot %s evaluation %s in state %s".formatted(transition, id, state));
    }
}
