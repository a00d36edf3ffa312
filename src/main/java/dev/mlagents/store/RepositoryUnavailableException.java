package dev.mlagents.store;

import dev.mlagents.eval.EvaluationException;

/** Persistence could not be reached or refused the operation. Aborts any run that hits it. */
public class RepositoryUnavailableException extends EvaluationException {

    public RepositoryUnavailableException(String message) {
        super(message);
    }

    public RepositoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
