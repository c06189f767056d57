package com.subagentplatform.orchestrator.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.subagentplatform.common.model.CompositeSignal;
import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.orchestrator.dispatch.InvocationStats;

import java.util.List;

/**
 * What a caller gets back for one batch: the composite signal plus the raw outcomes and
 * activity stats for logging.
 */
public record BatchReport(
    @JsonProperty("batchId") String batchId,
    @JsonProperty("signal") CompositeSignal signal,
    @JsonProperty("outcomes") List<InvocationOutcome> outcomes,
    @JsonProperty("stats") InvocationStats stats
) {
    public BatchReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }
}
