package com.subagentplatform.common.consensus;

import com.subagentplatform.common.model.CompositeSignal;
import com.subagentplatform.common.model.InvocationOutcome;

import java.util.List;

/**
 * Strategy contract for reducing one batch of invocation outcomes into a {@link CompositeSignal}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>     : no logging, no reactive types, no side effects</li>
 *   <li><b>Total</b>    : every input outcome appears either as a contribution or an abstention</li>
 *   <li><b>Non-null</b> : an empty or all-failure batch yields {@link CompositeSignal#noSignal}</li>
 * </ul>
 *
 * <p>Current implementation: {@link ConfidenceWeightedConsensusStrategy}.
 * Register a different {@code @Bean} in {@code OrchestratorConfig} to swap strategies.
 */
public interface ConsensusEngine {

    /**
     * @param outcomes terminal outcomes of one batch, possibly empty, never {@code null}
     * @return the composite signal, never {@code null}
     */
    CompositeSignal aggregate(List<InvocationOutcome> outcomes);
}
