package com.subagentplatform.orchestrator.dispatch;

import com.subagentplatform.common.exception.UnknownAgentException;
import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.orchestrator.executor.InvocationExecutor;
import com.subagentplatform.orchestrator.profile.AgentProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs a batch of invocation requests with at most {@code concurrencyLimit} active at once.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>every submitted {@code requestId} appears exactly once in the result; order is
 *       completion order, not submission order</li>
 *   <li>a failing, denied or timed-out invocation never aborts its siblings; individual
 *       failures are outcome values, never errors on the returned {@code Mono}</li>
 *   <li>with a batch deadline, requests still pending on expiry become {@code Timeout} and
 *       running ones are cancelled; outcomes already produced are kept</li>
 * </ul>
 */
@Service
public class BatchDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BatchDispatcher.class);

    private final AgentProfileStore profileStore;
    private final InvocationExecutor invocationExecutor;

    public BatchDispatcher(AgentProfileStore profileStore, InvocationExecutor invocationExecutor) {
        this.profileStore       = profileStore;
        this.invocationExecutor = invocationExecutor;
    }

    public Mono<List<InvocationOutcome>> runBatch(List<InvocationRequest> requests, int concurrencyLimit) {
        return runBatch(requests, concurrencyLimit, null, InvocationObserver.NOOP);
    }

    /**
     * @param batchDeadline ceiling for the whole batch, or {@code null} to wait for every invocation
     * @param observer      receives per-invocation callbacks for this batch only
     * @throws IllegalArgumentException if {@code concurrencyLimit < 1} or a requestId repeats
     */
    public Mono<List<InvocationOutcome>> runBatch(List<InvocationRequest> requests, int concurrencyLimit,
                                                  Duration batchDeadline, InvocationObserver observer) {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be at least 1, was " + concurrencyLimit);
        }
        Set<String> ids = new HashSet<>();
        for (InvocationRequest request : requests) {
            if (!ids.add(request.requestId())) {
                throw new IllegalArgumentException("Duplicate requestId in batch: " + request.requestId());
            }
        }
        List<InvocationRequest> batch = List.copyOf(requests);

        return Mono.defer(() -> {
            log.info("[Dispatcher] Batch started. requests={} concurrencyLimit={} batchDeadlineMs={}",
                     batch.size(), concurrencyLimit, batchDeadline == null ? "none" : batchDeadline.toMillis());

            Flux<InvocationOutcome> outcomes = Flux.fromIterable(batch)
                .flatMap(request -> dispatch(request, observer), concurrencyLimit);
            if (batchDeadline != null) {
                outcomes = outcomes.take(batchDeadline);
            }

            return outcomes.collectList()
                .map(completed -> timeOutPending(batch, completed, batchDeadline, observer))
                .doOnNext(all -> {
                    observer.onBatchCompleted(all);
                    log.info("[Dispatcher] Batch completed. outcomes={} successes={}",
                             all.size(), all.stream().filter(InvocationOutcome::isSuccess).count());
                });
        });
    }

    private Mono<InvocationOutcome> dispatch(InvocationRequest request, InvocationObserver observer) {
        AgentProfile profile;
        try {
            profile = profileStore.getProfile(request.agentName());
        } catch (UnknownAgentException e) {
            log.warn("[Dispatcher] Unknown agent. agent={} requestId={}", request.agentName(), request.requestId());
            InvocationOutcome outcome =
                new InvocationOutcome.ExecutorError(request.requestId(), request.agentName(), e.getMessage());
            return Mono.fromRunnable(() -> observer.onInvocationCompleted(outcome, 0L))
                .thenReturn(outcome);
        }
        return invocationExecutor.run(request, profile, Duration.ofMillis(profile.maxDurationMs()), observer);
    }

    private List<InvocationOutcome> timeOutPending(List<InvocationRequest> batch, List<InvocationOutcome> completed,
                                                   Duration batchDeadline, InvocationObserver observer) {
        if (completed.size() == batch.size()) {
            return completed;
        }
        Set<String> done = new HashSet<>();
        completed.forEach(outcome -> done.add(outcome.requestId()));

        List<InvocationOutcome> all = new ArrayList<>(completed);
        String reason = "batch deadline of " + (batchDeadline == null ? "?" : batchDeadline.toMillis()) + "ms elapsed";
        for (InvocationRequest request : batch) {
            if (!done.contains(request.requestId())) {
                InvocationOutcome timeout =
                    new InvocationOutcome.Timeout(request.requestId(), request.agentName(), reason);
                observer.onInvocationCompleted(timeout, 0L);
                all.add(timeout);
            }
        }
        log.warn("[Dispatcher] Batch deadline hit. completed={} timedOut={}",
                 completed.size(), all.size() - completed.size());
        return all;
    }
}
