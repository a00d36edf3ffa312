package dev.mlagents.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Process-wide settings for the evaluation engine. Loaded once from the environment (optionally
 * overridden programmatically) and immutable afterwards.
 */
@Getter
@Accessors(fluent = true)
public final class MlAgentsConfig extends BaseConfig {
    private final Optional<String> openrouterApiKey =
            Optional.ofNullable(getConfig("OPENROUTER_API_KEY", null, String.class));
    private final String openrouterBaseUrl =
            getConfig("OPENROUTER_BASE_URL", "https://openrouter.ai/api/v1");
    private final String appName = getConfig("MLAGENTS_APP_NAME", "ML-Agents-v2");
    private final Duration requestTimeout =
            getDurationConfig("MLAGENTS_REQUEST_TIMEOUT", 60, ChronoUnit.SECONDS);
    private final int maxConcurrency = getPositiveConfig("MLAGENTS_MAX_CONCURRENCY", 4);
    private final int maxAttempts = getPositiveConfig("MLAGENTS_RETRY_MAX_ATTEMPTS", 3);
    private final int malformedMaxAttempts =
            getPositiveConfig("MLAGENTS_RETRY_MALFORMED_MAX_ATTEMPTS", 2);
    private final Duration retryBaseDelay =
            getDurationConfig("MLAGENTS_RETRY_BASE_DELAY_MS", 1000, ChronoUnit.MILLIS);
    private final Duration retryMaxDelay =
            getDurationConfig("MLAGENTS_RETRY_MAX_DELAY_MS", 30_000, ChronoUnit.MILLIS);
    private final boolean enableTraceConsoleLog =
            getConfig("MLAGENTS_ENABLE_TRACE_CONSOLE_LOG", false);
    private final boolean debug = getConfig("MLAGENTS_DEBUG", false);

    public static MlAgentsConfig fromEnvironment() {
        return of();
    }

    public static MlAgentsConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new MlAgentsConfig(overridesMap);
    }

    private MlAgentsConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (requestTimeout.isZero()) {
            throw new IllegalArgumentException("MLAGENTS_REQUEST_TIMEOUT must be positive");
        }
        if (retryMaxDelay.compareTo(retryBaseDelay) < 0) {
            throw new IllegalArgumentException(
                    "MLAGENTS_RETRY_MAX_DELAY_MS (%d) must be >= MLAGENTS_RETRY_BASE_DELAY_MS (%d)"
                            .formatted(retryMaxDelay.toMillis(), retryBaseDelay.toMillis()));
        }
    }
}
