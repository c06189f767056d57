package com.subagentplatform.orchestrator.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.subagentplatform.common.exception.SchemaValidationException;
import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.AgentResult;
import com.subagentplatform.common.model.Sentiment;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Checks a raw agent payload against the profile's declared output schema and builds the
 * typed {@link AgentResult}. A payload that fails any rule never becomes a success.
 *
 * <p>Rules:
 * <ul>
 *   <li>payload is a JSON object holding every {@code outputSchema} key with a non-null value</li>
 *   <li>{@code sentiment} is one of bullish / bearish / neutral (case-insensitive)</li>
 *   <li>{@code confidence} is a number in [0, 1]</li>
 *   <li>{@code summary} is text</li>
 *   <li>{@code factors}, when present, is an array of text</li>
 * </ul>
 */
public final class AgentResultValidator {

    private AgentResultValidator() {}

    /**
     * @throws SchemaValidationException describing the first rule the payload breaks
     */
    public static AgentResult validate(AgentProfile profile, JsonNode payload) {
        String agent = profile.name();
        if (payload == null || !payload.isObject()) {
            throw new SchemaValidationException(agent, "payload is not a JSON object", String.valueOf(payload));
        }

        List<String> missing = new ArrayList<>();
        for (String key : new TreeSet<>(profile.outputSchema())) {
            if (!payload.hasNonNull(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaValidationException(agent, "missing required keys " + missing, payload.toString());
        }

        JsonNode sentimentNode = payload.get("sentiment");
        Sentiment sentiment = sentimentNode.isTextual() ? Sentiment.find(sentimentNode.asText()).orElse(null) : null;
        if (sentiment == null) {
            throw new SchemaValidationException(agent,
                "sentiment must be bullish, bearish or neutral but was " + sentimentNode, payload.toString());
        }

        JsonNode confidenceNode = payload.get("confidence");
        if (!confidenceNode.isNumber()) {
            throw new SchemaValidationException(agent,
                "confidence must be a number but was " + confidenceNode, payload.toString());
        }
        double confidence = confidenceNode.asDouble();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new SchemaValidationException(agent,
                "confidence must be within [0, 1] but was " + confidence, payload.toString());
        }

        JsonNode summaryNode = payload.get("summary");
        if (!summaryNode.isTextual()) {
            throw new SchemaValidationException(agent, "summary must be text", payload.toString());
        }

        List<String> factors = new ArrayList<>();
        JsonNode factorsNode = payload.get("factors");
        if (factorsNode != null && !factorsNode.isNull()) {
            if (!factorsNode.isArray()) {
                throw new SchemaValidationException(agent, "factors must be an array", payload.toString());
            }
            for (JsonNode factor : factorsNode) {
                if (!factor.isTextual()) {
                    throw new SchemaValidationException(agent, "factors must contain only text", payload.toString());
                }
                factors.add(factor.asText());
            }
        }

        return new AgentResult(sentiment, confidence, summaryNode.asText(), factors, payload.deepCopy());
    }
}
