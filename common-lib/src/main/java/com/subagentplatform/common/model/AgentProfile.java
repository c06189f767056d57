package com.subagentplatform.common.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Declarative definition of one subagent. Created once at load time and shared read-only
 * across all invocations.
 *
 * <p>{@code outputSchema} always contains {@link #MANDATORY_KEYS}; the compact constructor
 * merges them in and takes defensive copies of every collection.
 */
public record AgentProfile(
    String name,
    String description,
    String systemPrompt,
    Set<String> allowedToolPatterns,
    Set<CapabilityTag> deniedCapabilities,
    long maxDurationMs,
    int maxContextTokens,
    Set<String> outputSchema,
    String model
) {
    public static final Set<String> MANDATORY_KEYS = Set.of("sentiment", "confidence", "summary");

    public AgentProfile {
        allowedToolPatterns = allowedToolPatterns == null ? Set.of() : Set.copyOf(allowedToolPatterns);
        deniedCapabilities  = deniedCapabilities == null ? Set.of() : Set.copyOf(deniedCapabilities);
        Set<String> schema = new LinkedHashSet<>(MANDATORY_KEYS);
        if (outputSchema != null) {
            schema.addAll(outputSchema);
        }
        outputSchema = Set.copyOf(schema);
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        description  = description == null ? "" : description;
    }

    public boolean denies(CapabilityTag capability) {
        return deniedCapabilities.contains(capability);
    }
}
