package com.subagentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Validated payload of a successful invocation. Only built after the raw payload passed the
 * agent's output schema, so {@code confidence} is always within [0, 1].
 */
public record AgentResult(
    @JsonProperty("sentiment") Sentiment sentiment,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("summary") String summary,
    @JsonProperty("factors") List<String> factors,
    @JsonProperty("raw") JsonNode raw
) {
    public AgentResult {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
