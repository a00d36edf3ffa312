package dev.mlagents.agent;

import javax.annotation.Nullable;

/** Result of extracting an answer from a raw reply: an answer or a parse failure message. */
public record ParseResult(@Nullable Answer answer, @Nullable String failure) {
    public ParseResult {
        if ((answer == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of answer or failure must be set");
        }
    }

    public static ParseResult success(Answer answer) {
        return new ParseResult(answer, null);
    }

    public static ParseResult failure(String failure) {
        return new ParseResult(null, failure);
    }

    public boolean isSuccess() {
        return answer != null;
    }
}
