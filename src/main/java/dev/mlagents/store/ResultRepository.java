package dev.mlagents.store;

import dev.mlagents.eval.EvaluationQuestionResult;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Storage of per-question results, keyed by {@code (evaluationId, questionId)}. All methods may
 * throw {@link RepositoryUnavailableException}.
 */
public interface ResultRepository {
    /**
     * Inserts or replaces the result for its key. A key that already holds a terminal result is
     * left untouched.
     *
     * @return the result stored for the key after the call
     */
    EvaluationQuestionResult upsert(EvaluationQuestionResult result);

    Optional<EvaluationQuestionResult> get(String evaluationId, String questionId);

    /** Results of the evaluation that have a terminal status. */
    List<EvaluationQuestionResult> listTerminal(String evaluationId);

    /** Every result of the evaluation, terminal or not, ordered by question id. */
    List<EvaluationQuestionResult> list(String evaluationId);

    /** Implementation for embedding and test doubling */
    class InMemoryImpl implements ResultRepository {
        private record Key(String evaluationId, String questionId) {}

        private final Map<Key, EvaluationQuestionResult> results = new ConcurrentHashMap<>();

        @Override
        public EvaluationQuestionResult upsert(EvaluationQuestionResult result) {
            return results.compute(
                    new Key(result.evaluationId(), result.questionId()),
                    (key, existing) ->
                            existing != null && existing.isTerminal() ? existing : result);
        }

        @Override
        public Optional<EvaluationQuestionResult> get(String evaluationId, String questionId) {
            return Optional.ofNullable(results.get(new Key(evaluationId, questionId)));
        }

        @Override
        public List<EvaluationQuestionResult> listTerminal(String evaluationId) {
            return list(evaluationId).stream()
                    .filter(EvaluationQuestionResult::isTerminal)
                    .toList();
        }

        @Override
        public List<EvaluationQuestionResult> list(String evaluationId) {
            return results.values().stream()
                    .filter(r -> r.evaluationId().equals(evaluationId))
                    .sorted(Comparator.comparing(EvaluationQuestionResult::questionId))
                    .toList();
        }
    }
}
