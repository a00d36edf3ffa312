package dev.mlagents.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mlagents.benchmark.Question;
import dev.mlagents.gateway.GatewayRequest;
import dev.mlagents.gateway.RawResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Base for runners that differ only in prompt and in how free text is split into an answer.
 *
 * <p>Replies that look like a JSON object are read as {@code {"answer": ..., "reasoning": ...}}
 * ({@code final_answer} is accepted as well). Anything else goes to {@link #extract(String)}.
 */
public abstract class PromptingAgentRunner implements AgentRunner {
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final String strategyId;
    private final PromptStrategy prompt;

    protected PromptingAgentRunner(String strategyId, PromptStrategy prompt) {
        this.strategyId = strategyId;
        this.prompt = prompt;
    }

    @Override
    public String strategyId() {
        return strategyId;
    }

    @Override
    public GatewayRequest buildRequest(Question question, AgentConfig config) {
        return new GatewayRequest(
                config.modelId(),
                prompt.systemPrompt(),
                prompt.userPrompt(question),
                config.doubleParameter(AgentConfig.TEMPERATURE),
                config.longParameter(AgentConfig.MAX_TOKENS));
    }

    @Override
    public ParseResult parseAnswer(RawResponse response) {
        var content = response.content() == null ? "" : response.content().strip();
        if (content.isEmpty()) {
            return ParseResult.failure("empty response");
        }
        if (content.startsWith("{")) {
            return parseJson(content);
        }
        var answer = extract(content);
        if (answer.value().isBlank()) {
            return ParseResult.failure("no answer found in response");
        }
        return ParseResult.success(answer);
    }

    /** Splits a free-text reply into answer and reasoning. */
    protected abstract Answer extract(String content);

    @Override
    public List<String> validate(AgentConfig config) {
        var errors = new ArrayList<String>();
        try {
            config.doubleParameter(AgentConfig.TEMPERATURE)
                    .filter(t -> !(t >= 0.0 && t <= 2.0))
                    .ifPresent(t -> errors.add("temperature must be between 0.0 and 2.0: " + t));
        } catch (NumberFormatException e) {
            errors.add(
                    "temperature is not a number: "
                            + config.parameter(AgentConfig.TEMPERATURE).orElse(""));
        }
        try {
            var maxTokens = config.longParameter(AgentConfig.MAX_TOKENS);
            if (maxTokens.isPresent() && maxTokens.get() <= 0) {
                errors.add("max_tokens must be positive: " + maxTokens.get());
            } else {
                maxTokens.ifPresent(m -> validateMaxTokens(m, errors));
            }
        } catch (NumberFormatException e) {
            errors.add(
                    "max_tokens is not an integer: "
                            + config.parameter(AgentConfig.MAX_TOKENS).orElse(""));
        }
        return errors;
    }

    /** Hook for strategy-specific token limits. */
    protected void validateMaxTokens(long maxTokens, List<String> errors) {}

    /** Removes the first matching prefix, ignoring case, and trims the rest. */
    protected static String stripPrefix(String text, List<String> prefixes) {
        var trimmed = text.strip();
        var lower = trimmed.toLowerCase(Locale.ROOT);
        for (var prefix : prefixes) {
            if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return trimmed.substring(prefix.length()).strip();
            }
        }
        return trimmed;
    }

    private ParseResult parseJson(String content) {
        JsonNode node;
        try {
            node = JSON_MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            return ParseResult.failure("invalid JSON response: " + e.getOriginalMessage());
        }
        if (!node.isObject()) {
            return ParseResult.failure("JSON response is not an object");
        }
        var answer = text(node, "answer").or(() -> text(node, "final_answer"));
        if (answer.isEmpty() || answer.get().isBlank()) {
            return ParseResult.failure("JSON response has no answer");
        }
        return ParseResult.success(
                Answer.of(answer.get().strip(), text(node, "reasoning").orElse(null)));
    }

    private static Optional<String> text(JsonNode node, String field) {
        @Nullable JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.isValueNode() ? value.asText() : value.toString());
    }
}
