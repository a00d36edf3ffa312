package dev.mlagents.agent;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * Pairing of a reasoning strategy with a target model and its parameters. Value object: two
 * configs with identical fields are interchangeable.
 *
 * @param strategy reasoning strategy identifier, e.g. {@code chain_of_thought}
 * @param modelId provider model identifier, e.g. {@code anthropic/claude-3-haiku}
 * @param parameters strategy and sampling parameters
 */
public record AgentConfig(
        @Nonnull String strategy,
        @Nonnull String modelId,
        @Nonnull Map<String, String> parameters) {
    public static final String TEMPERATURE = "temperature";
    public static final String MAX_TOKENS = "max_tokens";

    public AgentConfig {
        Objects.requireNonNull(strategy);
        Objects.requireNonNull(modelId);
        parameters = Map.copyOf(parameters);
    }

    public static AgentConfig of(String strategy, String modelId) {
        return new AgentConfig(strategy, modelId, Map.of());
    }

    public Optional<String> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    /** Numeric parameter; empty when absent, {@link NumberFormatException} when not a number. */
    public Optional<Double> doubleParameter(String name) {
        return parameter(name).map(String::trim).map(Double::valueOf);
    }

    /** Integer parameter; empty when absent, {@link NumberFormatException} when not an integer. */
    public Optional<Long> longParameter(String name) {
        return parameter(name).map(String::trim).map(Long::valueOf);
    }
}
