package dev.mlagents.agent;

import java.util.List;

/** Strategy {@code none}: asks for the answer directly, no reasoning. */
public class DirectAnswerRunner extends PromptingAgentRunner {
    public static final String STRATEGY_ID = "none";

    private static final List<String> ANSWER_PREFIXES =
            List.of("Final answer:", "The answer is:", "Answer:");

    public DirectAnswerRunner() {
        super(STRATEGY_ID, PromptStrategy.DIRECT);
    }

    @Override
    protected Answer extract(String content) {
        return Answer.of(stripPrefix(content, ANSWER_PREFIXES));
    }
}
