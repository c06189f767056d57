package com.subagentplatform.common.exception;

public class UnknownAgentException extends RuntimeException {
    private final String agentName;

    public UnknownAgentException(String agentName) {
        super("Unknown agent: " + agentName);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
