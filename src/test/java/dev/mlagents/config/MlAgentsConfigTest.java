package dev.mlagents.config;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class MlAgentsConfigTest {
    private static final String NULL = BaseConfig.NULL_OVERRIDE;

    @Test
    void defaults() {
        var config =
                MlAgentsConfig.of(
                        "OPENROUTER_API_KEY", NULL,
                        "OPENROUTER_BASE_URL", NULL,
                        "MLAGENTS_MAX_CONCURRENCY", NULL,
                        "MLAGENTS_RETRY_MAX_ATTEMPTS", NULL,
                        "MLAGENTS_RETRY_MALFORMED_MAX_ATTEMPTS", NULL,
                        "MLAGENTS_RETRY_BASE_DELAY_MS", NULL,
                        "MLAGENTS_RETRY_MAX_DELAY_MS", NULL,
                        "MLAGENTS_REQUEST_TIMEOUT", NULL);

        assertThat(config.openrouterApiKey()).isEmpty();
        assertThat(config.openrouterBaseUrl()).isEqualTo("https://openrouter.ai/api/v1");
        assertThat(config.maxConcurrency()).isEqualTo(4);
        assertThat(config.maxAttempts()).isEqualTo(3);
        assertThat(config.malformedMaxAttempts()).isEqualTo(2);
        assertThat(config.retryBaseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.retryMaxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void overrides() {
        var config =
                MlAgentsConfig.of(
                        "OPENROUTER_API_KEY", "sk-test",
                        "MLAGENTS_MAX_CONCURRENCY", "16",
                        "MLAGENTS_RETRY_BASE_DELAY_MS", "250",
                        "MLAGENTS_RETRY_MAX_DELAY_MS", "2000",
                        "MLAGENTS_ENABLE_TRACE_CONSOLE_LOG", "true");

        assertThat(config.openrouterApiKey()).contains("sk-test");
        assertThat(config.maxConcurrency()).isEqualTo(16);
        assertThat(config.retryBaseDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.retryMaxDelay()).isEqualTo(Duration.ofMillis(2000));
        assertThat(config.enableTraceConsoleLog()).isTrue();
    }

    @Test
    void danglingOverrideKeyRejected() {
        assertThatThrownBy(() -> MlAgentsConfig.of("MLAGENTS_MAX_CONCURRENCY"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MLAGENTS_MAX_CONCURRENCY");
    }

    @Test
    void nonPositiveConcurrencyRejected() {
        assertThatThrownBy(() -> MlAgentsConfig.of("MLAGENTS_MAX_CONCURRENCY", "0"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MLAGENTS_MAX_CONCURRENCY");
    }

    @Test
    void maxDelayBelowBaseDelayRejected() {
        assertThatThrownBy(
                        () ->
                                MlAgentsConfig.of(
                                        "MLAGENTS_RETRY_BASE_DELAY_MS", "5000",
                                        "MLAGENTS_RETRY_MAX_DELAY_MS", "1000"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("MLAGENTS_RETRY_MAX_DELAY_MS");
    }

    @Test
    void nonNumericValueRejected() {
        assertThatThrownBy(() -> MlAgentsConfig.of("MLAGENTS_RETRY_MAX_ATTEMPTS", "three"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("three");
    }
}
