package dev.mlagents.agent;

import dev.mlagents.benchmark.Question;

/**
 * System prompt plus user prompt template. The template's {@code {question}} placeholder is
 * replaced with the question text.
 */
public record PromptStrategy(String systemPrompt, String userPromptTemplate) {
    public static final PromptStrategy DIRECT =
            new PromptStrategy(
                    "You are a helpful assistant that provides direct, concise answers.",
                    "Answer the following question directly:\n\nQuestion: {question}");

    public static final PromptStrategy CHAIN_OF_THOUGHT =
            new PromptStrategy(
                    "You are a helpful assistant that thinks step by step.",
                    "Think through this question step by step, then provide your answer:\n\n"
                            + "Question: {question}");

    public String userPrompt(Question question) {
        return userPromptTemplate.replace("{question}", question.text());
    }
}
