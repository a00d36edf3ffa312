package dev.mlagents.failure;

import dev.mlagents.gateway.RawError;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps gateway errors to a {@link FailureReason}. Pure and deterministic: the same error always
 * classifies the same way.
 */
public class FailureClassifier {
    private static final Pattern INVALID_MODEL =
            Pattern.compile(
                    "(invalid|unknown|unsupported|not a valid|no such)\\s+model"
                            + "|model\\s+(not found|does not exist|is not available|not supported)",
                    Pattern.CASE_INSENSITIVE);

    public FailureReason classify(RawError error) {
        return switch (error.kind()) {
            case HTTP_STATUS -> fromStatus(error.statusCode().orElse(0), error.message());
            case TIMEOUT -> FailureReason.TIMEOUT;
            case CONNECTION -> FailureReason.TRANSIENT_NETWORK;
            case MALFORMED_BODY -> FailureReason.MALFORMED_RESPONSE;
            case CLIENT -> fromMessage(error.message());
        };
    }

    private static FailureReason fromStatus(int status, String message) {
        switch (status) {
            case 401, 402, 403:
                return FailureReason.AUTHENTICATION;
            case 404:
                return FailureReason.INVALID_CONFIGURATION;
            case 408, 504:
                return FailureReason.TIMEOUT;
            case 429:
                return FailureReason.RATE_LIMITED;
            case 400, 422:
                return INVALID_MODEL.matcher(message).find()
                        ? FailureReason.INVALID_CONFIGURATION
                        : fromMessage(message);
            default:
                if (status >= 500 && status < 600) {
                    return FailureReason.TRANSIENT_NETWORK;
                }
                return fromMessage(message);
        }
    }

    private static FailureReason fromMessage(String message) {
        var lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("rate limit")) {
            return FailureReason.RATE_LIMITED;
        }
        return FailureReason.UNKNOWN;
    }
}
