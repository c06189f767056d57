package com.subagentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregated decision input produced from one batch of subagent outcomes.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code finalSentiment}     : sentiment carrying the largest confidence weight</li>
 *   <li>{@code aggregateConfidence}: winning weight over total weight, in [0.0, 1.0]</li>
 *   <li>{@code contributions}      : one entry per successful vote, in outcome order</li>
 *   <li>{@code abstentions}        : one entry per non-success outcome, in outcome order</li>
 * </ul>
 */
public record CompositeSignal(
    @JsonProperty("finalSentiment") Sentiment finalSentiment,
    @JsonProperty("aggregateConfidence") double aggregateConfidence,
    @JsonProperty("contributions") List<Contribution> contributions,
    @JsonProperty("abstentions") List<Abstention> abstentions
) {
    public CompositeSignal {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
        abstentions   = abstentions == null ? List.of() : List.copyOf(abstentions);
    }

    /** Degenerate composite for a batch that produced no usable vote. */
    public static CompositeSignal noSignal(List<Abstention> abstentions) {
        return new CompositeSignal(Sentiment.NEUTRAL, 0.0, List.of(), abstentions);
    }

    public boolean hasSignal() {
        return !contributions.isEmpty() && aggregateConfidence > 0.0;
    }

    public record Contribution(
        @JsonProperty("agentName") String agentName,
        @JsonProperty("sentiment") Sentiment sentiment,
        @JsonProperty("confidence") double confidence
    ) {}

    public record Abstention(
        @JsonProperty("agentName") String agentName,
        @JsonProperty("reason") String reason
    ) {}
}
