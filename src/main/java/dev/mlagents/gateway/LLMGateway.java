package dev.mlagents.gateway;

import java.time.Duration;

/**
 * Executes one request against a model provider. Remote failures are returned as {@link RawError}
 * values rather than thrown, so callers can classify them without inspecting exception types.
 */
public interface LLMGateway {
    GatewayOutcome execute(GatewayRequest request, Duration timeout);
}
