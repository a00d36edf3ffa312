package dev.mlagents.eval;

import dev.mlagents.benchmark.Question;
import dev.mlagents.failure.FailureReason;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Judges answers and aggregates terminal results into {@link EvaluationResults}. The matcher can
 * be chosen per benchmark; unlisted benchmarks use the default one.
 */
public class ScoringFunction {
    private final AnswerMatcher defaultMatcher;
    private final Map<String, AnswerMatcher> matchersByBenchmark;

    public ScoringFunction() {
        this(AnswerMatcher.normalized(), Map.of());
    }

    public ScoringFunction(
            AnswerMatcher defaultMatcher, Map<String, AnswerMatcher> matchersByBenchmark) {
        this.defaultMatcher = defaultMatcher;
        this.matchersByBenchmark = Map.copyOf(matchersByBenchmark);
    }

    public boolean judge(String benchmarkId, Question question, String answer) {
        return matchersByBenchmark
                .getOrDefault(benchmarkId, defaultMatcher)
                .matches(question.expectedAnswer(), answer);
    }

    /**
     * Aggregates the terminal results of an evaluation. Every question must have exactly one
     * terminal result.
     */
    public EvaluationResults aggregate(
            List<Question> questions, Collection<EvaluationQuestionResult> results) {
        Map<String, EvaluationQuestionResult> byQuestion =
                results.stream()
                        .filter(EvaluationQuestionResult::isTerminal)
                        .collect(
                                Collectors.toMap(
                                        EvaluationQuestionResult::questionId, Function.identity()));
        var judgments = new ArrayList<QuestionJudgment>(questions.size());
        var failedByReason = new EnumMap<FailureReason, Integer>(FailureReason.class);
        int succeeded = 0;
        int failed = 0;
        int correct = 0;
        for (var question : questions) {
            var result = byQuestion.get(question.id());
            if (result == null) {
                throw new IllegalStateException(
                        "question %s has no terminal result".formatted(question.id()));
            }
            if (result.isSucceeded()) {
                succeeded++;
                if (result.isCorrect()) {
                    correct++;
                }
            } else {
                failed++;
                result.failureReason().ifPresent(r -> failedByReason.merge(r, 1, Integer::sum));
            }
            judgments.add(
                    new QuestionJudgment(
                            question.id(),
                            question.expectedAnswer(),
                            result.answer(),
                            result.status().orElseThrow(),
                            result.isCorrect(),
                            result.failureReason()));
        }
        double accuracy = succeeded == 0 ? 0.0 : (double) correct / succeeded;
        return new EvaluationResults(
                questions.size(), succeeded, failed, failedByReason, correct, accuracy, judgments);
    }
}
