package dev.mlagents.gateway;

import javax.annotation.Nullable;

/** Either a raw response or a raw error. Exactly one of the two is present. */
public record GatewayOutcome(@Nullable RawResponse response, @Nullable RawError error) {
    public GatewayOutcome {
        if ((response == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of response or error must be set");
        }
    }

    public static GatewayOutcome success(RawResponse response) {
        return new GatewayOutcome(response, null);
    }

    public static GatewayOutcome failure(RawError error) {
        return new GatewayOutcome(null, error);
    }

    public boolean isSuccess() {
        return response != null;
    }
}
