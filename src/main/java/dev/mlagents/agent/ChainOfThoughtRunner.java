package dev.mlagents.agent;

import java.util.List;
import java.util.Locale;

/**
 * Strategy {@code chain_of_thought}: asks the model to reason step by step, then separates the
 * reasoning from the final answer.
 */
public class ChainOfThoughtRunner extends PromptingAgentRunner {
    public static final String STRATEGY_ID = "chain_of_thought";
    static final long MIN_MAX_TOKENS = 200;

    // checked in order, first present wins
    private static final List<String> ANSWER_MARKERS =
            List.of("Final answer:", "Answer:", "Therefore:", "So the answer is:");

    public ChainOfThoughtRunner() {
        super(STRATEGY_ID, PromptStrategy.CHAIN_OF_THOUGHT);
    }

    @Override
    protected Answer extract(String content) {
        var lower = content.toLowerCase(Locale.ROOT);
        for (var marker : ANSWER_MARKERS) {
            int index = lower.lastIndexOf(marker.toLowerCase(Locale.ROOT));
            if (index >= 0) {
                var reasoning = content.substring(0, index).strip();
                var answer = content.substring(index + marker.length()).strip();
                return Answer.of(answer, reasoning);
            }
        }
        return lastSentence(content);
    }

    @Override
    protected void validateMaxTokens(long maxTokens, List<String> errors) {
        if (maxTokens < MIN_MAX_TOKENS) {
            errors.add(
                    "chain_of_thought needs max_tokens of at least %d: %d"
                            .formatted(MIN_MAX_TOKENS, maxTokens));
        }
    }

    private static Answer lastSentence(String content) {
        var body = content.strip();
        var end = body.endsWith(".") ? body.length() - 1 : body.length();
        int split = Math.max(body.lastIndexOf(". ", end - 1), body.lastIndexOf('\n', end - 1));
        if (split < 0) {
            return Answer.of(body);
        }
        return Answer.of(body.substring(split + 1).strip(), body.substring(0, split + 1).strip());
    }
}
