package dev.mlagents.eval;

import static org.assertj.core.api.Assertions.*;

import dev.mlagents.benchmark.Question;
import dev.mlagents.failure.FailureReason;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ScoringFunctionTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @ParameterizedTest
    @CsvSource({
        "Paris, paris, true",
        "Paris, '  Paris. ', true",
        "New York, new   york, true",
        "Paris, London, false",
        "42, 42.0, false"
    })
    void normalizedMatcher(String expected, String actual, boolean matches) {
        assertThat(AnswerMatcher.normalized().matches(expected, actual)).isEqualTo(matches);
    }

    @ParameterizedTest
    @CsvSource({
        "42, 42.0, true",
        "42, 42.004, true",
        "42, 42.1, false",
        "'1,000', 1000, true",
        "Paris, paris, true"
    })
    void numericMatcher(String expected, String actual, boolean matches) {
        assertThat(AnswerMatcher.numeric(0.01).matches(expected, actual)).isEqualTo(matches);
    }

    @Test
    void exactMatcherIsCaseSensitive() {
        assertThat(AnswerMatcher.exact().matches("Paris", "Paris")).isTrue();
        assertThat(AnswerMatcher.exact().matches("Paris", "paris")).isFalse();
    }

    @Test
    void matcherChosenPerBenchmark() {
        var scoring =
                new ScoringFunction(
                        AnswerMatcher.normalized(), Map.of("gsm8k", AnswerMatcher.numeric(0.001)));
        var question = Question.of("q1", "What is 84 / 2?", "42");

        assertThat(scoring.judge("gsm8k", question, "42.0")).isTrue();
        assertThat(scoring.judge("trivia", question, "42.0")).isFalse();
    }

    @Test
    void aggregateExcludesFailuresFromAccuracy() {
        var questions =
                List.of(
                        Question.of("q1", "a", "1"),
                        Question.of("q2", "b", "2"),
                        Question.of("q3", "c", "3"),
                        Question.of("q4", "d", "4"));
        var results =
                List.of(
                        EvaluationQuestionResult.succeeded(
                                "e", "q1", "1", Optional.empty(), true, 1, NOW),
                        EvaluationQuestionResult.succeeded(
                                "e", "q2", "7", Optional.empty(), false, 1, NOW),
                        EvaluationQuestionResult.failed(
                                "e", "q3", FailureReason.RATE_LIMITED, "429", 3, NOW),
                        EvaluationQuestionResult.failed(
                                "e", "q4", FailureReason.TIMEOUT, "slow", 3, NOW));

        var aggregate = new ScoringFunction().aggregate(questions, results);

        assertThat(aggregate.total()).isEqualTo(4);
        assertThat(aggregate.succeeded()).isEqualTo(2);
        assertThat(aggregate.failed()).isEqualTo(2);
        assertThat(aggregate.succeeded() + aggregate.failed()).isEqualTo(aggregate.total());
        assertThat(aggregate.correct()).isEqualTo(1);
        assertThat(aggregate.accuracy()).isEqualTo(0.5);
        assertThat(aggregate.failedByReason())
                .containsOnly(
                        entry(FailureReason.RATE_LIMITED, 1), entry(FailureReason.TIMEOUT, 1));
        assertThat(aggregate.judgments())
                .extracting(QuestionJudgment::questionId)
                .containsExactly("q1", "q2", "q3", "q4");
    }

    @Test
    void accuracyIsZeroWhenNothingSucceeded() {
        var aggregate =
                new ScoringFunction()
                        .aggregate(
                                List.of(Question.of("q1", "a", "1")),
                                List.of(
                                        EvaluationQuestionResult.failed(
                                                "e",
                                                "q1",
                                                FailureReason.AUTHENTICATION,
                                                "401",
                                                1,
                                                NOW)));

        assertThat(aggregate.accuracy()).isZero();
        assertThat(aggregate.failed()).isEqualTo(1);
    }

    @Test
    void aggregateRequiresEveryQuestionTerminal() {
        var questions = List.of(Question.of("q1", "a", "1"));
        var retrying =
                EvaluationQuestionResult.retrying("e", "q1", FailureReason.TIMEOUT, "slow", 1, NOW);

        assertThatThrownBy(() -> new ScoringFunction().aggregate(questions, List.of(retrying)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("q1");
    }
}
