package dev.mlagents.agent;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Structured answer extracted from a model reply.
 *
 * @param value the final answer
 * @param reasoning reasoning that preceded it, for strategies that produce one
 */
public record Answer(@Nonnull String value, @Nonnull Optional<String> reasoning) {
    public Answer {
        Objects.requireNonNull(value);
        Objects.requireNonNull(reasoning);
    }

    public static Answer of(String value) {
        return new Answer(value, Optional.empty());
    }

    public static Answer of(String value, String reasoning) {
        return new Answer(
                value,
                reasoning == null || reasoning.isBlank()
                        ? Optional.empty()
                        : Optional.of(reasoning));
    }
}
