package dev.mlagents.store;

import dev.mlagents.eval.Evaluation;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Storage of evaluation lifecycle records. May throw {@link RepositoryUnavailableException}. */
public interface EvaluationRepository {
    Optional<Evaluation> load(String evaluationId);

    /** Inserts or replaces the evaluation with the same id. */
    void save(Evaluation evaluation);

    /** Every evaluation, newest first. */
    List<Evaluation> list();

    /** Implementation for embedding and test doubling */
    class InMemoryImpl implements EvaluationRepository {
        private final Map<String, Evaluation> evaluations = new ConcurrentHashMap<>();

        @Override
        public Optional<Evaluation> load(String evaluationId) {
            return Optional.ofNullable(evaluations.get(evaluationId));
        }

        @Override
        public void save(Evaluation evaluation) {
            evaluations.put(evaluation.id(), evaluation);
        }

        @Override
        public List<Evaluation> list() {
            return evaluations.values().stream()
                    .sorted(Comparator.comparing(Evaluation::createdAt).reversed())
                    .toList();
        }
    }
}
