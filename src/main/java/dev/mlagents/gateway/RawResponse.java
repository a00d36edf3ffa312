package dev.mlagents.gateway;

import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * Successful model reply, before any answer extraction.
 *
 * @param content text content of the first choice
 * @param model model that actually served the request
 */
public record RawResponse(@Nonnull String content, @Nonnull String model) {
    public RawResponse {
        Objects.requireNonNull(content);
        Objects.requireNonNull(model);
    }
}
