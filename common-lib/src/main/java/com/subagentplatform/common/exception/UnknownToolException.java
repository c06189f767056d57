package com.subagentplatform.common.exception;

public class UnknownToolException extends RuntimeException {
    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
