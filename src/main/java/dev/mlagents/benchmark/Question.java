package dev.mlagents.benchmark;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * A single benchmark question.
 *
 * @param id stable identifier, unique within its benchmark
 * @param text question text sent to the model
 * @param expectedAnswer ground truth answer
 * @param metadata additional key-value data carried from ingestion
 */
public record Question(
        @Nonnull String id,
        @Nonnull String text,
        @Nonnull String expectedAnswer,
        @Nonnull Map<String, String> metadata) {
    public Question {
        Objects.requireNonNull(id);
        Objects.requireNonNull(text);
        Objects.requireNonNull(expectedAnswer);
        if (id.isBlank()) {
            throw new IllegalArgumentException("question id must not be blank");
        }
        metadata = Map.copyOf(metadata);
    }

    public static Question of(String id, String text, String expectedAnswer) {
        return new Question(id, text, expectedAnswer, Map.of());
    }
}
