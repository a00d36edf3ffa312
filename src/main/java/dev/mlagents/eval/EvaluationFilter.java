package dev.mlagents.eval;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nonnull;

/**
 * Criteria for {@link EvaluationOrchestrator#listEvaluations(EvaluationFilter)}. Absent criteria
 * match every evaluation; the limit applies after filtering.
 */
public record EvaluationFilter(
        @Nonnull Optional<EvaluationState> state,
        @Nonnull Optional<String> benchmarkId,
        @Nonnull Optional<String> strategy,
        @Nonnull OptionalInt limit) {
    private static final EvaluationFilter ALL =
            new EvaluationFilter(
                    Optional.empty(), Optional.empty(), Optional.empty(), OptionalInt.empty());

    public EvaluationFilter {
        Objects.requireNonNull(state);
        Objects.requireNonNull(benchmarkId);
        Objects.requireNonNull(strategy);
        Objects.requireNonNull(limit);
        if (limit.isPresent() && limit.getAsInt() < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit.getAsInt());
        }
    }

    public static EvaluationFilter all() {
        return ALL;
    }

    public EvaluationFilter withState(@Nonnull EvaluationState state) {
        return new EvaluationFilter(Optional.of(state), benchmarkId, strategy, limit);
    }

    public EvaluationFilter withBenchmark(@Nonnull String benchmarkId) {
        return new EvaluationFilter(state, Optional.of(benchmarkId), strategy, limit);
    }

    public EvaluationFilter withStrategy(@Nonnull String strategy) {
        return new EvaluationFilter(state, benchmarkId, Optional.of(strategy), limit);
    }

    public EvaluationFilter withLimit(int limit) {
        return new EvaluationFilter(state, benchmarkId, strategy, OptionalInt.of(limit));
    }

    boolean matches(Evaluation evaluation) {
        return state.map(s -> s == evaluation.state()).orElse(true)
                && benchmarkId.map(evaluation.benchmarkId()::equals).orElse(true)
                && strategy.map(evaluation.agentConfig().strategy()::equals).orElse(true);
    }
}
