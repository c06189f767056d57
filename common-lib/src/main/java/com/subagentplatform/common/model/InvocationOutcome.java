package com.subagentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal result of running one {@link InvocationRequest}. Every variant carries the
 * originating {@code requestId} and {@code agentName} for correlation.
 */
public sealed interface InvocationOutcome
    permits InvocationOutcome.Success, InvocationOutcome.Timeout,
            InvocationOutcome.PolicyViolation, InvocationOutcome.ExecutorError {

    String requestId();

    String agentName();

    @JsonIgnore
    default boolean isSuccess() {
        return false;
    }

    /** Short variant label used in logs and stats: SUCCESS, TIMEOUT, POLICY_VIOLATION, EXECUTOR_ERROR. */
    @JsonProperty("kind")
    String kind();

    /** Human-readable reason this outcome casts no vote. Empty for {@link Success}. */
    @JsonProperty("abstentionReason")
    String abstentionReason();

    record Success(String requestId, String agentName, AgentResult result, long durationMs)
        implements InvocationOutcome {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String kind() {
            return "SUCCESS";
        }

        @Override
        public String abstentionReason() {
            return "";
        }
    }

    record Timeout(String requestId, String agentName, String reason) implements InvocationOutcome {

        @Override
        public String kind() {
            return "TIMEOUT";
        }

        @Override
        public String abstentionReason() {
            return "timed out: " + reason;
        }
    }

    record PolicyViolation(String requestId, String agentName, String toolName, String reason)
        implements InvocationOutcome {

        @Override
        public String kind() {
            return "POLICY_VIOLATION";
        }

        @Override
        public String abstentionReason() {
            return "policy violation on tool " + toolName + ": " + reason;
        }
    }

    record ExecutorError(String requestId, String agentName, String message) implements InvocationOutcome {

        @Override
        public String kind() {
            return "EXECUTOR_ERROR";
        }

        @Override
        public String abstentionReason() {
            return "executor error: " + message;
        }
    }
}
