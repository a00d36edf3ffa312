package dev.mlagents.export;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.mlagents.agent.AgentConfig;
import dev.mlagents.benchmark.BenchmarkStore;
import dev.mlagents.benchmark.Question;
import dev.mlagents.eval.Evaluation;
import dev.mlagents.eval.EvaluationComparison;
import dev.mlagents.eval.EvaluationException;
import dev.mlagents.eval.EvaluationNotFoundException;
import dev.mlagents.eval.EvaluationQuestionResult;
import dev.mlagents.eval.ScoringFunction;
import dev.mlagents.failure.FailureReason;
import dev.mlagents.store.EvaluationRepository;
import dev.mlagents.store.ResultRepository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.SneakyThrows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultsExporterTest {
    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final List<Question> QUESTIONS =
            List.of(
                    Question.of("q1", "What is the capital of France?", "Paris"),
                    Question.of("q2", "What is 2, plus 2?", "4"));

    private final EvaluationRepository evaluations = new EvaluationRepository.InMemoryImpl();
    private final ResultRepository results = new ResultRepository.InMemoryImpl();
    private final BenchmarkStore benchmarks =
            new BenchmarkStore.InMemoryImpl().put("trivia", QUESTIONS);
    private final ResultsExporter exporter = new ResultsExporter(evaluations, results, benchmarks);

    @TempDir Path tempDir;

    @BeforeEach
    void beforeEach() {
        evaluations.save(
                Evaluation.create(
                        "e1", "trivia", AgentConfig.of("none", "openai/gpt-4o-mini"), NOW));
        evaluations.save(
                Evaluation.create(
                        "empty", "trivia", AgentConfig.of("none", "openai/gpt-4o-mini"), NOW));
        results.upsert(
                EvaluationQuestionResult.succeeded(
                        "e1", "q1", "Paris", Optional.of("It is the capital."), true, 1, NOW));
        results.upsert(
                EvaluationQuestionResult.failed(
                        "e1", "q2", FailureReason.RATE_LIMITED, "HTTP 429", 3, NOW));
    }

    @Test
    @SneakyThrows
    void writesOneRowPerResult() {
        var file = tempDir.resolve("results.csv");

        exporter.writeCsv("e1", file);

        var lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0))
                .isEqualTo(
                        "evaluation_id,question_id,question_text,expected_answer,actual_answer,"
                                + "is_correct,status,failure_reason,attempts,updated_at");
        List<Map<String, String>> rows =
                new CsvMapper()
                        .readerForMapOf(String.class)
                        .with(CsvSchema.emptySchema().withHeader())
                        .<Map<String, String>>readValues(file.toFile())
                        .readAll();
        assertThat(rows.get(0))
                .containsEntry("question_text", "What is the capital of France?")
                .containsEntry("actual_answer", "Paris")
                .containsEntry("is_correct", "true")
                .containsEntry("status", "succeeded")
                .containsEntry("failure_reason", "")
                .containsEntry("updated_at", "2026-01-01T12:00:00Z");
        assertThat(rows.get(1))
                .containsEntry("question_text", "What is 2, plus 2?")
                .containsEntry("actual_answer", "")
                .containsEntry("status", "failed")
                .containsEntry("failure_reason", "rate-limited")
                .containsEntry("attempts", "3");
    }

    @Test
    void rejectsEmptyResultSet() {
        assertThatThrownBy(() -> exporter.writeCsv("empty", tempDir.resolve("empty.csv")))
                .isInstanceOf(EvaluationException.class)
                .hasMessageContaining("no results");
        assertThat(tempDir.resolve("empty.csv")).doesNotExist();
    }

    @Test
    void rejectsUnknownEvaluation() {
        assertThatThrownBy(() -> exporter.writeCsv("missing", tempDir.resolve("x.csv")))
                .isInstanceOf(EvaluationNotFoundException.class);
    }

    @Test
    @SneakyThrows
    void serializesAggregateAsJson() {
        var aggregate = new ScoringFunction().aggregate(QUESTIONS, results.listTerminal("e1"));

        var json = new ObjectMapper().readTree(exporter.toJson(aggregate));

        assertThat(json.get("total").asInt()).isEqualTo(2);
        assertThat(json.get("succeeded").asInt()).isEqualTo(1);
        assertThat(json.get("accuracy").asDouble()).isEqualTo(1.0);
        assertThat(json.get("failed_by_reason").get("rate-limited").asInt()).isEqualTo(1);
        var judgments = json.get("judgments");
        assertThat(judgments).hasSize(2);
        assertThat(judgments.get(1).get("status").asText()).isEqualTo("failed");
        assertThat(judgments.get(1).get("failure_reason").asText()).isEqualTo("rate-limited");
        assertThat(judgments.get(0).get("actual_answer").asText()).isEqualTo("Paris");
    }

    @Test
    @SneakyThrows
    void serializesComparisonAsJson() {
        var entry =
                new EvaluationComparison.Entry(
                        "e1",
                        "trivia",
                        "none",
                        "openai/gpt-4o-mini",
                        0.5,
                        Duration.ofMinutes(2),
                        1);
        var comparison =
                new EvaluationComparison(
                        List.of(entry, entry),
                        0.5,
                        0.5,
                        0.5,
                        Duration.ofMinutes(2),
                        Duration.ofMinutes(2),
                        NOW);

        var json = new ObjectMapper().readTree(exporter.toJson(comparison));

        assertThat(json.get("best_accuracy").asDouble()).isEqualTo(0.5);
        assertThat(json.get("fastest_execution").asText()).isEqualTo("PT2M");
        assertThat(json.get("generated_at").asText()).isEqualTo("2026-01-01T12:00:00Z");
        assertThat(json.get("evaluations").get(0).get("error_count").asInt()).isEqualTo(1);
        assertThat(json.get("evaluations").get(1).get("model_id").asText())
                .isEqualTo("openai/gpt-4o-mini");
    }
}
