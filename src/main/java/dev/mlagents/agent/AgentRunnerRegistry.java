package dev.mlagents.agent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Agent runners keyed by strategy id. */
public final class AgentRunnerRegistry {
    private final Map<String, AgentRunner> runners;

    private AgentRunnerRegistry(Map<String, AgentRunner> runners) {
        this.runners = Map.copyOf(runners);
    }

    /** Registry with the built-in {@code none} and {@code chain_of_thought} strategies. */
    public static AgentRunnerRegistry defaults() {
        return of(List.of(new DirectAnswerRunner(), new ChainOfThoughtRunner()));
    }

    public static AgentRunnerRegistry of(List<? extends AgentRunner> runners) {
        var byId = new LinkedHashMap<String, AgentRunner>();
        for (var runner : runners) {
            if (byId.putIfAbsent(runner.strategyId(), runner) != null) {
                throw new IllegalArgumentException(
                        "duplicate runner for strategy " + runner.strategyId());
            }
        }
        return new AgentRunnerRegistry(byId);
    }

    public Optional<AgentRunner> find(String strategyId) {
        return Optional.ofNullable(runners.get(strategyId));
    }

    public Set<String> strategyIds() {
        return runners.keySet();
    }
}
