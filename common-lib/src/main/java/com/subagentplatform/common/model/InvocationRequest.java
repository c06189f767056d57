package com.subagentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of work in a batch: run {@code agentName} on {@code taskPrompt}.
 */
public record InvocationRequest(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("agentName") String agentName,
    @JsonProperty("taskPrompt") String taskPrompt,
    @JsonProperty("submittedAt") Instant submittedAt
) {
    public InvocationRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(agentName, "agentName");
        taskPrompt  = taskPrompt == null ? "" : taskPrompt;
        submittedAt = submittedAt == null ? Instant.now() : submittedAt;
    }

    public static InvocationRequest of(String agentName, String taskPrompt) {
        return new InvocationRequest(UUID.randomUUID().toString(), agentName, taskPrompt, Instant.now());
    }

    public static InvocationRequest of(String requestId, String agentName, String taskPrompt) {
        return new InvocationRequest(requestId, agentName, taskPrompt, Instant.now());
    }
}
