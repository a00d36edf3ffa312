package dev.mlagents.gateway;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * One chat request to a model.
 *
 * @param modelId provider model identifier, e.g. {@code openai/gpt-4o-mini}
 * @param systemPrompt system message
 * @param userPrompt user message
 * @param temperature sampling temperature, provider default when empty
 * @param maxTokens completion token cap, provider default when empty
 */
public record GatewayRequest(
        @Nonnull String modelId,
        @Nonnull String systemPrompt,
        @Nonnull String userPrompt,
        @Nonnull Optional<Double> temperature,
        @Nonnull Optional<Long> maxTokens) {
    public GatewayRequest {
        Objects.requireNonNull(modelId);
        Objects.requireNonNull(systemPrompt);
        Objects.requireNonNull(userPrompt);
        Objects.requireNonNull(temperature);
        Objects.requireNonNull(maxTokens);
    }

    public GatewayRequest(String modelId, String systemPrompt, String userPrompt) {
        this(modelId, systemPrompt, userPrompt, Optional.empty(), Optional.empty());
    }
}
