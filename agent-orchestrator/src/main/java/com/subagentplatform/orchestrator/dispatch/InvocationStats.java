package com.subagentplatform.orchestrator.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable snapshot of one batch's activity, keyed by agent name.
 *
 * @param peakConcurrency largest number of invocations observed running at the same time
 */
public record InvocationStats(
    @JsonProperty("agents") Map<String, AgentStats> agents,
    @JsonProperty("peakConcurrency") int peakConcurrency
) {
    public InvocationStats {
        agents = agents == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(agents));
    }

    public static InvocationStats empty() {
        return new InvocationStats(Map.of(), 0);
    }

    public AgentStats forAgent(String agentName) {
        return agents.get(agentName);
    }

    /**
     * @param outcomes  terminal outcome counts by kind (SUCCESS, TIMEOUT, POLICY_VIOLATION, EXECUTOR_ERROR)
     * @param toolCalls calls per tool, by status: {@code toolName → (OK|DENIED|FAILED → count)}
     */
    public record AgentStats(
        @JsonProperty("invocations") long invocations,
        @JsonProperty("outcomes") Map<String, Long> outcomes,
        @JsonProperty("totalDurationMs") long totalDurationMs,
        @JsonProperty("maxDurationMs") long maxDurationMs,
        @JsonProperty("toolCalls") Map<String, Map<String, Long>> toolCalls
    ) {
        public AgentStats {
            outcomes  = outcomes == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(outcomes));
            toolCalls = toolCalls == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(toolCalls));
        }

        public long outcomeCount(String kind) {
            return outcomes.getOrDefault(kind, 0L);
        }

        public long toolCallCount(String toolName, String status) {
            return toolCalls.getOrDefault(toolName, Map.of()).getOrDefault(status, 0L);
        }
    }
}
