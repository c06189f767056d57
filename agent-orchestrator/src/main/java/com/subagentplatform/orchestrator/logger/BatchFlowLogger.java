package com.subagentplatform.orchestrator.logger;

import com.subagentplatform.common.model.CompositeSignal;
import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.common.model.ToolCallResult;
import com.subagentplatform.common.trace.TraceContextUtil;
import com.subagentplatform.orchestrator.dispatch.InvocationObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.List;
import java.util.function.Consumer;

/**
 * Logs each stage of a batch's journey through the orchestration engine without changing
 * pipeline behavior. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #BATCH_RECEIVED}       : caller submitted a batch</li>
 *   <li>{@link #INVOCATION_STARTED}   : a request took a concurrency slot</li>
 *   <li>{@link #TOOL_DENIED}          : the policy enforcer refused a tool call</li>
 *   <li>{@link #INVOCATION_COMPLETED} : a request reached its terminal outcome</li>
 *   <li>{@link #OUTCOMES_COLLECTED}   : every request in the batch is terminal</li>
 *   <li>{@link #SIGNAL_AGGREGATED}    : the composite signal was computed</li>
 * </ol>
 *
 * <p>Invocation-level stages are logged through {@link #forBatch(String)}, an observer bound to
 * one batch. Pipeline-level stages use {@link #stage(String)} with {@code doOnEach}, reading the
 * batchId from the Reactor Context.
 */
@Component
public class BatchFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(BatchFlowLogger.class);

    public static final String BATCH_RECEIVED       = "BATCH_RECEIVED";
    public static final String INVOCATION_STARTED   = "INVOCATION_STARTED";
    public static final String TOOL_DENIED          = "TOOL_DENIED";
    public static final String INVOCATION_COMPLETED = "INVOCATION_COMPLETED";
    public static final String OUTCOMES_COLLECTED   = "OUTCOMES_COLLECTED";
    public static final String SIGNAL_AGGREGATED    = "SIGNAL_AGGREGATED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * Bridges Context → MDC for the duration of the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String batchId = TraceContextUtil.getBatchId(signal.getContextView());
            TraceContextUtil.withMdc(batchId, () ->
                log.info("[BatchFlow] stage={} batchId={}", stageName, batchId)
            );
        };
    }

    public void logBatchReceived(String batchId, int requests, int concurrencyLimit) {
        TraceContextUtil.withMdc(batchId, () ->
            log.info("[BatchFlow] stage={} batchId={} requests={} concurrencyLimit={}",
                     BATCH_RECEIVED, batchId, requests, concurrencyLimit)
        );
    }

    /**
     * Logs a compact summary of the aggregated signal: sentiment, confidence and the number
     * of votes and abstentions.
     */
    public void logSignal(CompositeSignal signal, String batchId) {
        TraceContextUtil.withMdc(batchId, () ->
            log.info("[BatchFlow] stage={} batchId={} hasSignal={} finalSentiment={} aggregateConfidence={} "
                     + "contributions={} abstentions={}",
                     SIGNAL_AGGREGATED, batchId, signal.hasSignal(), signal.finalSentiment().label(),
                     String.format("%.3f", signal.aggregateConfidence()),
                     signal.contributions().size(), signal.abstentions().size())
        );
    }

    /** Observer that logs invocation-level stages under {@code batchId}. */
    public InvocationObserver forBatch(String batchId) {
        return new InvocationObserver() {
            @Override
            public void onInvocationStarted(InvocationRequest request) {
                TraceContextUtil.withMdc(batchId, () ->
                    log.info("[BatchFlow] stage={} batchId={} agent={} requestId={}",
                             INVOCATION_STARTED, batchId, request.agentName(), request.requestId())
                );
            }

            @Override
            public void onToolCall(InvocationRequest request, String toolName, ToolCallResult.Status status) {
                if (status != ToolCallResult.Status.DENIED) return;
                TraceContextUtil.withMdc(batchId, () ->
                    log.warn("[BatchFlow] stage={} batchId={} agent={} requestId={} tool={}",
                             TOOL_DENIED, batchId, request.agentName(), request.requestId(), toolName)
                );
            }

            @Override
            public void onInvocationCompleted(InvocationOutcome outcome, long durationMs) {
                TraceContextUtil.withMdc(batchId, () ->
                    log.info("[BatchFlow] stage={} batchId={} agent={} requestId={} outcome={} durationMs={}",
                             INVOCATION_COMPLETED, batchId, outcome.agentName(), outcome.requestId(),
                             outcome.kind(), durationMs)
                );
            }

            @Override
            public void onBatchCompleted(List<InvocationOutcome> outcomes) {
                TraceContextUtil.withMdc(batchId, () ->
                    log.info("[BatchFlow] stage={} batchId={} outcomes={}", OUTCOMES_COLLECTED, batchId, outcomes.size())
                );
            }
        };
    }
}
