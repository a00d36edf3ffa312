package dev.mlagents.eval;

/** Lifecycle state of an {@link Evaluation}. */
public enum EvaluationState {
    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    ERRORED("errored"),
    CANCELLED("cancelled");

    private final String code;

    EvaluationState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Completed and errored evaluations never change again. Cancelled ones can be resumed. */
    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED;
    }

    @Override
    public String toString() {
        return code;
    }
}
