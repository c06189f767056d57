package com.subagentplatform.orchestrator.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.subagentplatform.common.exception.PolicyViolationException;
import com.subagentplatform.common.model.PolicyDecision;
import com.subagentplatform.common.model.ToolCallResult;
import reactor.core.publisher.Mono;

/**
 * Callback handed to an {@link AgentExecutor}. It is the only path from a running agent to a
 * tool provider, and every call through it is authorized individually.
 */
public interface ToolAuthorizer {

    /** Checks a tool without calling it. */
    PolicyDecision authorize(String toolName);

    /**
     * Authorizes and, if allowed, calls the tool. Denials and provider errors come back as
     * {@link ToolCallResult} values, never as errors on the returned {@code Mono}.
     */
    Mono<ToolCallResult> call(String toolName, JsonNode input);

    /**
     * For executors that treat a denial as fatal: throws instead of returning a Deny.
     * The invocation then ends as a policy violation.
     *
     * @throws PolicyViolationException if the tool is denied
     */
    void requireAllowed(String toolName);
}
