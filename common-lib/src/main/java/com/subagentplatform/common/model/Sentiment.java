package com.subagentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Directional view reported by a subagent.
 *
 * <p>{@link #tieBreakRank()} fixes the precedence used when two sentiments carry equal
 * aggregate weight: {@code NEUTRAL > BEARISH > BULLISH}.
 */
public enum Sentiment {
    BULLISH(0),
    BEARISH(1),
    NEUTRAL(2);

    private final int tieBreakRank;

    Sentiment(int tieBreakRank) {
        this.tieBreakRank = tieBreakRank;
    }

    /** Higher rank wins a tie. */
    public int tieBreakRank() {
        return tieBreakRank;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive lookup; empty for anything other than bullish / bearish / neutral. */
    public static Optional<Sentiment> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
            .filter(s -> s.name().equalsIgnoreCase(normalized))
            .findFirst();
    }

    /**
     * @throws IllegalArgumentException for anything other than bullish / bearish / neutral
     */
    @JsonCreator
    public static Sentiment fromLabel(String value) {
        return find(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown sentiment: " + value));
    }
}
