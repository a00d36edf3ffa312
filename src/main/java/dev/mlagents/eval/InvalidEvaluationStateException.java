package dev.mlagents.eval;

/** Thrown when an operation is not allowed in the evaluation's current lifecycle state. */
public class InvalidEvaluationStateException extends EvaluationException {

    public InvalidEvaluationStateException(String message) {
        super(message);
    }
}
