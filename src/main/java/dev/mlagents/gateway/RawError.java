package dev.mlagents.gateway;

import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Transport or provider failure of a single request, as observed by the gateway.
 *
 * @param kind coarse origin of the failure
 * @param statusCode HTTP status when the provider answered with one
 * @param message provider or transport message
 * @param cause underlying exception, if any
 */
public record RawError(
        @Nonnull Kind kind,
        @Nonnull Optional<Integer> statusCode,
        @Nonnull String message,
        @Nullable Throwable cause) {

    public enum Kind {
        /** The provider answered with a non-2xx status. */
        HTTP_STATUS,
        /** No answer within the request timeout. */
        TIMEOUT,
        /** Connection could not be established or broke mid-request. */
        CONNECTION,
        /** The provider answered but the body could not be read. */
        MALFORMED_BODY,
        /** Anything raised locally before or after the remote call. */
        CLIENT
    }

    public RawError {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(statusCode);
        message = message == null ? "" : message;
    }

    public static RawError httpStatus(int statusCode, String message) {
        return new RawError(Kind.HTTP_STATUS, Optional.of(statusCode), message, null);
    }

    public static RawError timeout(String message) {
        return timeout(message, null);
    }

    public static RawError timeout(String message, @Nullable Throwable cause) {
        return new RawError(Kind.TIMEOUT, Optional.empty(), message, cause);
    }

    public static RawError connection(String message, @Nullable Throwable cause) {
        return new RawError(Kind.CONNECTION, Optional.empty(), message, cause);
    }

    public static RawError malformedBody(String message, @Nullable Throwable cause) {
        return new RawError(Kind.MALFORMED_BODY, Optional.empty(), message, cause);
    }

    public static RawError client(String message, @Nullable Throwable cause) {
        return new RawError(Kind.CLIENT, Optional.empty(), message, cause);
    }

    /** One-line description suitable for persisting alongside a failed result. */
    public String describe() {
        return statusCode.map(code -> "%s %d: %s".formatted(kind, code, message))
                .orElseGet(() -> "%s: %s".formatted(kind, message));
    }
}
