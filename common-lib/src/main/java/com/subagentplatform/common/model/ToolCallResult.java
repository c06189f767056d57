package com.subagentplatform.common.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * What the executing agent sees for one tool call. A denied or failed call is data the agent
 * can adapt to, not an error that ends the invocation.
 */
public record ToolCallResult(String toolName, Status status, JsonNode payload, String error) {

    public enum Status { OK, DENIED, FAILED }

    public static ToolCallResult ok(String toolName, JsonNode payload) {
        return new ToolCallResult(toolName, Status.OK, payload, null);
    }

    public static ToolCallResult denied(String toolName, String reason) {
        return new ToolCallResult(toolName, Status.DENIED, null, reason);
    }

    public static ToolCallResult failed(String toolName, String error) {
        return new ToolCallResult(toolName, Status.FAILED, null, error);
    }

    public boolean isOk() {
        return status == Status.OK;
    }
}
