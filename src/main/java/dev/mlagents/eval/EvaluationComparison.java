package dev.mlagents.eval;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Side-by-side view of two or more completed evaluations.
 *
 * @param averageAccuracy unweighted mean of the evaluations' accuracies
 */
public record EvaluationComparison(
        List<Entry> evaluations,
        double bestAccuracy,
        double worstAccuracy,
        double averageAccuracy,
        Duration fastestExecution,
        Duration slowestExecution,
        Instant generatedAt) {

    public EvaluationComparison {
        evaluations = List.copyOf(evaluations);
    }

    /**
     * One compared evaluation.
     *
     * @param errorCount questions that failed
     */
    public record Entry(
            String evaluationId,
            String benchmarkId,
            String strategy,
            String modelId,
            double accuracy,
            Duration executionTime,
            int errorCount) {}

    /** Compares completed evaluations; each must carry its aggregate. */
    static EvaluationComparison of(List<Evaluation> completed, Instant generatedAt) {
        if (completed.size() < 2) {
            throw new IllegalArgumentException(
                    "at least 2 evaluations are required for a comparison, got "
                            + completed.size());
        }
        var entries = completed.stream().map(EvaluationComparison::toEntry).toList();
        var accuracies = entries.stream().mapToDouble(Entry::accuracy).summaryStatistics();
        var times = entries.stream().map(Entry::executionTime).toList();
        return new EvaluationComparison(
                entries,
                accuracies.getMax(),
                accuracies.getMin(),
                accuracies.getAverage(),
                times.stream().min(Comparator.naturalOrder()).orElseThrow(),
                times.stream().max(Comparator.naturalOrder()).orElseThrow(),
                generatedAt);
    }

    private static Entry toEntry(Evaluation evaluation) {
        var results =
                evaluation
                        .results()
                        .orElseThrow(
                                () ->
                                        new InvalidEvaluationStateException(
                                                "evaluation %s has no results to compare (%s)"
                                                        .formatted(
                                                                evaluation.id(),
                                                                evaluation.state())));
        return new Entry(
                evaluation.id(),
                evaluation.benchmarkId(),
                evaluation.agentConfig().strategy(),
                evaluation.agentConfig().modelId(),
                results.accuracy(),
                evaluation.executionTime().orElse(Duration.ZERO),
                results.failed());
    }
}
