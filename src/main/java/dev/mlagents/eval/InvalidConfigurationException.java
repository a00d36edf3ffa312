package dev.mlagents.eval;

import java.util.List;

/** Thrown when an agent configuration is rejected. Carries every violation found. */
public class InvalidConfigurationException extends EvaluationException {
    private final List<String> errors;

    public InvalidConfigurationException(List<String> errors) {
        super("Invalid agent configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
