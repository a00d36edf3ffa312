package dev.mlagents.agent;

import static org.assertj.core.api.Assertions.*;

import dev.mlagents.benchmark.Question;
import dev.mlagents.gateway.RawResponse;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ChainOfThoughtRunnerTest {
    private final ChainOfThoughtRunner runner = new ChainOfThoughtRunner();

    @Test
    void buildsStepByStepPrompt() {
        var request =
                runner.buildRequest(
                        Question.of("q1", "What is 6 times 7?", "42"),
                        AgentConfig.of("chain_of_thought", "anthropic/claude-3-haiku"));

        assertThat(request.systemPrompt()).contains("step by step");
        assertThat(request.userPrompt()).contains("What is 6 times 7?");
    }

    @Test
    void splitsAtFinalAnswerMarker() {
        var result =
                runner.parseAnswer(
                        new RawResponse(
                                "6 times 7 means adding 6 seven times.\nThat gives 42.\n"
                                        + "Final answer: 42",
                                "m"));

        assertThat(result.answer().value()).isEqualTo("42");
        assertThat(result.answer().reasoning())
                .hasValueSatisfying(r -> assertThat(r).contains("seven times"));
    }

    @Test
    void usesMarkersInOrder() {
        var therefore =
                runner.parseAnswer(
                        new RawResponse("All men are mortal. Therefore: Socrates is mortal", "m"));
        assertThat(therefore.answer().value()).isEqualTo("Socrates is mortal");

        var soTheAnswer =
                runner.parseAnswer(new RawResponse("Two plus two. So the answer is: 4", "m"));
        assertThat(soTheAnswer.answer().value()).isEqualTo("4");
    }

    @Test
    void fallsBackToLastSentence() {
        var result =
                runner.parseAnswer(
                        new RawResponse("First we add the numbers. The total is 12.", "m"));

        assertThat(result.answer().value()).isEqualTo("The total is 12.");
        assertThat(result.answer().reasoning()).contains("First we add the numbers.");
    }

    @Test
    void singleSentenceIsTheAnswer() {
        var result = runner.parseAnswer(new RawResponse("12", "m"));

        assertThat(result.answer().value()).isEqualTo("12");
        assertThat(result.answer().reasoning()).isEmpty();
    }

    @Test
    void markerWithNothingAfterItIsAParseFailure() {
        var result = runner.parseAnswer(new RawResponse("Thinking... Final answer:", "m"));

        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void requiresRoomForReasoning() {
        List<String> errors =
                runner.validate(
                        new AgentConfig(
                                "chain_of_thought",
                                "anthropic/claude-3-haiku",
                                Map.of("max_tokens", "100")));
        assertThat(errors).singleElement().satisfies(e -> assertThat(e).contains("at least 200"));

        assertThat(
                        runner.validate(
                                new AgentConfig(
                                        "chain_of_thought",
                                        "anthropic/claude-3-haiku",
                                        Map.of("max_tokens", "512"))))
                .isEmpty();
    }

    @Test
    void registryKnowsBothStrategies() {
        var registry = AgentRunnerRegistry.defaults();

        assertThat(registry.strategyIds()).containsExactlyInAnyOrder("none", "chain_of_thought");
        assertThat(registry.find("chain_of_thought"))
                .containsInstanceOf(ChainOfThoughtRunner.class);
        assertThat(registry.find("tree_of_thought")).isEmpty();
        var duplicated = List.<AgentRunner>of(new DirectAnswerRunner(), new DirectAnswerRunner());
        assertThatThrownBy(() -> AgentRunnerRegistry.of(duplicated))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
