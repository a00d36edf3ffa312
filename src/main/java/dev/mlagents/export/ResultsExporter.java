package dev.mlagents.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mlagents.benchmark.BenchmarkStore;
import dev.mlagents.benchmark.Question;
import dev.mlagents.eval.EvaluationComparison;
import dev.mlagents.eval.EvaluationException;
import dev.mlagents.eval.EvaluationNotFoundException;
import dev.mlagents.eval.EvaluationQuestionResult;
import dev.mlagents.eval.EvaluationResults;
import dev.mlagents.store.EvaluationRepository;
import dev.mlagents.store.ResultRepository;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** Writes evaluation results out as CSV (one row per question) or JSON (the aggregate). */
@Slf4j
public class ResultsExporter {
    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final ObjectMapper JSON_MAPPER = createObjectMapper();

    private final EvaluationRepository evaluationRepository;
    private final ResultRepository resultRepository;
    private final BenchmarkStore benchmarkStore;

    public ResultsExporter(
            EvaluationRepository evaluationRepository,
            ResultRepository resultRepository,
            BenchmarkStore benchmarkStore) {
        this.evaluationRepository = evaluationRepository;
        this.resultRepository = resultRepository;
        this.benchmarkStore = benchmarkStore;
    }

    /**
     * Writes every stored result of the evaluation, terminal or not, to a CSV file with a header
     * row.
     *
     * @throws EvaluationNotFoundException if the evaluation does not exist
     * @throws EvaluationException if the evaluation has no results yet
     */
    public void writeCsv(String evaluationId, Path path) throws IOException {
        var evaluation =
                evaluationRepository
                        .load(evaluationId)
                        .orElseThrow(() -> new EvaluationNotFoundException(evaluationId));
        var results = resultRepository.list(evaluationId);
        if (results.isEmpty()) {
            throw new EvaluationException(
                    "evaluation %s has no results to export".formatted(evaluationId));
        }
        Map<String, Question> questions =
                benchmarkStore.exists(evaluation.benchmarkId())
                        ? benchmarkStore.questions(evaluation.benchmarkId()).stream()
                                .collect(Collectors.toMap(Question::id, Function.identity()))
                        : Map.of();
        var rows = results.stream().map(r -> toRow(r, questions.get(r.questionId()))).toList();
        var schema = CSV_MAPPER.schemaFor(CsvRow.class).withHeader();
        CSV_MAPPER.writer(schema).writeValue(path.toFile(), rows);
        log.info("exported {} result(s) of evaluation {} to {}", rows.size(), evaluationId, path);
    }

    /** The aggregate as a JSON document with snake_case keys. */
    public String toJson(EvaluationResults results) {
        return writeJson(results, "evaluation results");
    }

    /** A comparison as JSON; durations are ISO-8601 strings. */
    public String toJson(EvaluationComparison comparison) {
        return writeJson(comparison, "evaluation comparison");
    }

    private static String writeJson(Object value, String what) {
        try {
            return JSON_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EvaluationException("failed to serialize " + what, e);
        }
    }

    private static CsvRow toRow(EvaluationQuestionResult result, @Nullable Question question) {
        return new CsvRow(
                result.evaluationId(),
                result.questionId(),
                question == null ? "" : question.text(),
                question == null ? "" : question.expectedAnswer(),
                result.answer() == null ? "" : result.answer(),
                result.correct() == null ? "" : result.correct().toString(),
                result.status().map(Object::toString).orElse("retrying"),
                result.failureReason().map(Object::toString).orElse(""),
                result.attempts(),
                result.updatedAt().toString());
    }

    private static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module()) // For Optional support
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.WRITE_ENUMS_USING_TO_STRING)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    @JsonPropertyOrder({
        "evaluation_id",
        "question_id",
        "question_text",
        "expected_answer",
        "actual_answer",
        "is_correct",
        "status",
        "failure_reason",
        "attempts",
        "updated_at"
    })
    public record CsvRow(
            @JsonProperty("evaluation_id") String evaluationId,
            @JsonProperty("question_id") String questionId,
            @JsonProperty("question_text") String questionText,
            @JsonProperty("expected_answer") String expectedAnswer,
            @JsonProperty("actual_answer") String actualAnswer,
            @JsonProperty("is_correct") String isCorrect,
            @JsonProperty("status") String status,
            @JsonProperty("failure_reason") String failureReason,
            @JsonProperty("attempts") int attempts,
            @JsonProperty("updated_at") String updatedAt) {}
}
