package dev.mlagents.failure;

import java.util.Arrays;

/** Why a question could not be answered. Closed set; the code is what gets persisted. */
public enum FailureReason {
    TRANSIENT_NETWORK("transient-network", "Temporary network or provider error"),
    RATE_LIMITED("rate-limited", "Provider rate limit exceeded"),
    TIMEOUT("timeout", "No response within the request timeout"),
    MALFORMED_RESPONSE("malformed-response", "Response could not be parsed into an answer"),
    AUTHENTICATION("authentication", "Credentials rejected or insufficient credits"),
    INVALID_CONFIGURATION("invalid-configuration", "Model or request configuration is invalid"),
    UNKNOWN("unknown", "Unclassified failure");

    private final String code;
    private final String description;

    FailureReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    public static FailureReason fromCode(String code) {
        return Arrays.stream(values())
                .filter(reason -> reason.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown failure reason: " + code));
    }

    @Override
    public String toString() {
        return code;
    }
}
