package dev.mlagents.eval;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/** Decides whether a produced answer matches the expected one. */
@FunctionalInterface
public interface AnswerMatcher {
    boolean matches(String expected, String actual);

    /** Exact string equality. */
    static AnswerMatcher exact() {
        return String::equals;
    }

    /** Equality after lower-casing, collapsing whitespace and dropping a trailing period. */
    static AnswerMatcher normalized() {
        return (expected, actual) -> normalize(expected).equals(normalize(actual));
    }

    /**
     * Numeric comparison within an absolute tolerance. Falls back to {@link #normalized()} when
     * either side is not a number.
     */
    static AnswerMatcher numeric(double tolerance) {
        return (expected, actual) -> {
            var e = parseNumber(expected);
            var a = parseNumber(actual);
            if (e.isPresent() && a.isPresent()) {
                return e.get().subtract(a.get()).abs().doubleValue() <= tolerance;
            }
            return normalized().matches(expected, actual);
        };
    }

    static String normalize(String value) {
        var normalized = value.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1).stripTrailing();
        }
        return normalized;
    }

    private static Optional<BigDecimal> parseNumber(String value) {
        var cleaned = value.strip().replace(",", "");
        if (cleaned.endsWith(".")) {
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
