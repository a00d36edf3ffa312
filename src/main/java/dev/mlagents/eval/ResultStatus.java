package dev.mlagents.eval;

/** Terminal status of a single question's result. */
public enum ResultStatus {
    SUCCEEDED("succeeded"),
    FAILED("failed");

    private final String code;

    ResultStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
