package com.subagentplatform.common.exception;

/**
 * Thrown by executors that treat a tool denial as fatal for the invocation.
 * The invocation then ends as a policy violation outcome naming {@link #getToolName()}.
 */
public class PolicyViolationException extends AgentException {
    private final String toolName;
    private final String reason;

    public PolicyViolationException(String agentName, String toolName, String reason) {
        super(agentName, "tool " + toolName + " denied: " + reason);
        this.toolName = toolName;
        this.reason = reason;
    }

    public String getToolName() {
        return toolName;
    }

    public String getReason() {
        return reason;
    }
}
