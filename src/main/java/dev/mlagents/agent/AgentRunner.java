package dev.mlagents.agent;

import dev.mlagents.benchmark.Question;
import dev.mlagents.gateway.GatewayRequest;
import dev.mlagents.gateway.RawResponse;
import java.util.List;

/**
 * A reasoning strategy: turns a question into a model request and a model reply into an answer.
 * Implementations are stateless and safe to call from many threads.
 */
public interface AgentRunner {
    /** Identifier matched against {@link AgentConfig#strategy()}. */
    String strategyId();

    GatewayRequest buildRequest(Question question, AgentConfig config);

    /** Extracts the answer. Never throws for unusable replies; returns a failure instead. */
    ParseResult parseAnswer(RawResponse response);

    /** Strategy-specific configuration problems. Empty when the config is usable. */
    default List<String> validate(AgentConfig config) {
        return List.of();
    }
}
