package com.subagentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Coarse classification of what a tool permits.
 * Policy decisions are made against these tags, independent of exact tool names.
 */
public enum CapabilityTag {
    READ_MARKET_DATA("read-market-data"),
    READ_ACCOUNT("read-account"),
    EXECUTE_TRADE("execute-trade"),
    RESEARCH("research"),
    COMPUTE("compute");

    private static final Map<String, CapabilityTag> BY_LABEL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(CapabilityTag::label, Function.identity()));

    private final String label;

    CapabilityTag(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves an external label ({@code execute-trade}) or enum name ({@code EXECUTE_TRADE}),
     * case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no capability
     */
    @JsonCreator
    public static CapabilityTag fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Capability label must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        CapabilityTag tag = BY_LABEL.get(normalized);
        if (tag == null) {
            throw new IllegalArgumentException("Unknown capability: " + value);
        }
        return tag;
    }

    @Override
    public String toString() {
        return label;
    }
}
