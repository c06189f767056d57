package com.subagentplatform.orchestrator.service;

import com.subagentplatform.common.consensus.ConsensusEngine;
import com.subagentplatform.common.model.CompositeSignal;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.common.trace.TraceContextUtil;
import com.subagentplatform.orchestrator.config.SubagentProperties;
import com.subagentplatform.orchestrator.dispatch.BatchDispatcher;
import com.subagentplatform.orchestrator.dispatch.InvocationObserver;
import com.subagentplatform.orchestrator.dispatch.InvocationStatsRecorder;
import com.subagentplatform.orchestrator.logger.BatchFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Caller-facing entry point: dispatch a batch of subagent requests, then reduce the outcomes
 * into one {@link CompositeSignal}.
 *
 * <p>Never fails for runtime conditions inside the batch. A batch where every agent failed
 * still yields a neutral, zero-confidence signal with one abstention per request.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    private final BatchDispatcher dispatcher;
    private final ConsensusEngine consensusEngine;
    private final BatchFlowLogger batchFlowLogger;
    private final SubagentProperties properties;

    public OrchestratorService(BatchDispatcher dispatcher, ConsensusEngine consensusEngine,
                               BatchFlowLogger batchFlowLogger, SubagentProperties properties) {
        this.dispatcher      = dispatcher;
        this.consensusEngine = consensusEngine;
        this.batchFlowLogger = batchFlowLogger;
        this.properties      = properties;
    }

    /** Submits with the configured default concurrency and batch deadline. */
    public Mono<BatchReport> submitBatch(List<InvocationRequest> requests) {
        SubagentProperties.Dispatch dispatch = properties.getDispatch();
        return submitBatch(requests, dispatch.getDefaultConcurrency(), dispatch.getDefaultBatchDeadlineMs());
    }

    /**
     * @param batchDeadlineMs ceiling for the whole batch; 0 or less waits for every invocation
     */
    public Mono<BatchReport> submitBatch(List<InvocationRequest> requests, int concurrencyLimit, long batchDeadlineMs) {
        String batchId = UUID.randomUUID().toString();
        Duration batchDeadline = batchDeadlineMs > 0 ? Duration.ofMillis(batchDeadlineMs) : null;
        InvocationStatsRecorder stats = new InvocationStatsRecorder();
        InvocationObserver observer = InvocationObserver.composite(batchFlowLogger.forBatch(batchId), stats);

        Mono<BatchReport> pipeline = Mono.defer(() -> {
                batchFlowLogger.logBatchReceived(batchId, requests.size(), concurrencyLimit);
                return dispatcher.runBatch(requests, concurrencyLimit, batchDeadline, observer);
            })
            .map(outcomes -> {
                CompositeSignal signal = consensusEngine.aggregate(outcomes);
                batchFlowLogger.logSignal(signal, batchId);
                return new BatchReport(batchId, signal, outcomes, stats.snapshot());
            })
            .doOnEach(batchFlowLogger.stage("REPORT_READY"))
            .doOnError(e -> log.error("[Orchestrator] Batch rejected. batchId={} reason={}", batchId, e.getMessage()));

        return TraceContextUtil.withBatchId(pipeline, batchId);
    }
}
