package dev.mlagents.eval;

import java.time.Instant;

/** Progress of a running evaluation, reported after every settled question. */
public record ProgressInfo(
        String evaluationId,
        int settled,
        int total,
        int succeeded,
        int failed,
        Instant startedAt,
        Instant lastUpdate) {

    public double completionPercentage() {
        if (total == 0) {
            return 100.0;
        }
        return settled * 100.0 / total;
    }
}
