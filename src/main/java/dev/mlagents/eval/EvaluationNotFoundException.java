package dev.mlagents.eval;

public class EvaluationNotFoundException extends EvaluationException {

    public EvaluationNotFoundException(String evaluationId) {
        super("Evaluation not found: " + evaluationId);
    }
}
