package com.subagentplatform.orchestrator.executor;

import java.util.List;

/**
 * Everything an {@link AgentExecutor} gets for one call. Built fresh per invocation: there is
 * no conversation history, prior tool result or state from earlier calls of the same agent.
 *
 * @param availableTools   registered tools the profile may use, to be declared to the model
 * @param maxContextTokens per-call token budget from the profile
 * @param model            model identifier from the profile, or {@code null} for the executor default
 */
public record AgentInvocation(
    String requestId,
    String agentName,
    String systemPrompt,
    String taskPrompt,
    List<String> availableTools,
    ToolAuthorizer toolAuthorizer,
    int maxContextTokens,
    String model
) {
    public AgentInvocation {
        availableTools = availableTools == null ? List.of() : List.copyOf(availableTools);
    }
}
