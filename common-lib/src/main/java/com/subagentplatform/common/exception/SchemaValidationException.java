package com.subagentplatform.common.exception;

/**
 * Final agent payload does not satisfy the declared output schema.
 * Carries the offending payload text for diagnosis.
 */
public class SchemaValidationException extends AgentException {
    private final String payload;

    public SchemaValidationException(String agentName, String message, String payload) {
        super(agentName, "output schema violation: " + message);
        this.payload = payload;
    }

    public SchemaValidationException(String agentName, String message, String payload, Throwable cause) {
        super(agentName, "output schema violation: " + message, cause);
        this.payload = payload;
    }

    public String getPayload() {
        return payload;
    }
}
