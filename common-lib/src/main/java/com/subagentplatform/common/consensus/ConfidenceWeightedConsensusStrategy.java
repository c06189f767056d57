package com.subagentplatform.common.consensus;

import com.subagentplatform.common.model.CompositeSignal;
import com.subagentplatform.common.model.CompositeSignal.Abstention;
import com.subagentplatform.common.model.CompositeSignal.Contribution;
import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.common.model.Sentiment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ConsensusEngine}: confidence-weighted voting over successful outcomes.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Each {@code Success} outcome votes its sentiment with weight = its confidence.</li>
 *   <li>{@code weight(s) = Σ confidence} of the votes for sentiment {@code s}.</li>
 *   <li>{@code finalSentiment} = sentiment with the largest weight. Equal weights resolve
 *       by {@link Sentiment#tieBreakRank()}: NEUTRAL &gt; BEARISH &gt; BULLISH.</li>
 *   <li>{@code aggregateConfidence = winningWeight / Σ weight(s)}.</li>
 *   <li>No votes, or a total weight of 0 → NEUTRAL with confidence 0.</li>
 * </ol>
 *
 * <p>Every non-success outcome is recorded as an abstention with the reason derived from its
 * variant. Per-sentiment sums are taken over sorted confidences, so the result depends only
 * on the multiset of votes, not on the order outcomes arrived in.
 */
public class ConfidenceWeightedConsensusStrategy implements ConsensusEngine {

    private static final Comparator<Map.Entry<Sentiment, Double>> BY_WEIGHT_THEN_CAUTION =
        Map.Entry.<Sentiment, Double>comparingByValue()
            .thenComparing(e -> e.getKey().tieBreakRank());

    @Override
    public CompositeSignal aggregate(List<InvocationOutcome> outcomes) {
        List<Contribution> contributions = new ArrayList<>();
        List<Abstention> abstentions     = new ArrayList<>();
        Map<Sentiment, List<Double>> votes = new EnumMap<>(Sentiment.class);

        for (InvocationOutcome outcome : outcomes) {
            if (outcome instanceof InvocationOutcome.Success success) {
                Sentiment sentiment = success.result().sentiment();
                double confidence   = success.result().confidence();
                contributions.add(new Contribution(success.agentName(), sentiment, confidence));
                votes.computeIfAbsent(sentiment, s -> new ArrayList<>()).add(confidence);
            } else {
                abstentions.add(new Abstention(outcome.agentName(), outcome.abstentionReason()));
            }
        }

        Map<Sentiment, Double> weights = new EnumMap<>(Sentiment.class);
        votes.forEach((sentiment, confidences) -> weights.put(sentiment, orderIndependentSum(confidences)));

        if (contributions.isEmpty()) {
            return CompositeSignal.noSignal(abstentions);
        }
        double totalWeight = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (totalWeight <= 0.0) {
            return new CompositeSignal(Sentiment.NEUTRAL, 0.0, contributions, abstentions);
        }

        Map.Entry<Sentiment, Double> winner = weights.entrySet().stream()
            .max(BY_WEIGHT_THEN_CAUTION)
            .orElseThrow();

        // clamped for floating-point safety
        double confidence = Math.max(0.0, Math.min(1.0, winner.getValue() / totalWeight));
        return new CompositeSignal(winner.getKey(), confidence, contributions, abstentions);
    }

    /** Sums in ascending order so the same multiset always yields the same bits. */
    private static double orderIndependentSum(List<Double> values) {
        return values.stream().sorted().mapToDouble(Double::doubleValue).sum();
    }
}
