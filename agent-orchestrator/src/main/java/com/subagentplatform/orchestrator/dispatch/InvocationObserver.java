package com.subagentplatform.orchestrator.dispatch;

import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.common.model.ToolCallResult;

import java.util.List;

/**
 * Per-batch hook for recording what the dispatcher does. Passed into each
 * {@code runBatch} call, so no counters live in process-wide state.
 *
 * <p>Callbacks arrive concurrently from worker threads; implementations must be thread-safe
 * and must not throw.
 */
public interface InvocationObserver {

    InvocationObserver NOOP = new InvocationObserver() {};

    default void onInvocationStarted(InvocationRequest request) {}

    default void onToolCall(InvocationRequest request, String toolName, ToolCallResult.Status status) {}

    /**
     * @param durationMs wall time from start to terminal outcome; 0 for requests that never
     *                   started (unknown agent, or still queued when the batch deadline hit)
     */
    default void onInvocationCompleted(InvocationOutcome outcome, long durationMs) {}

    default void onBatchCompleted(List<InvocationOutcome> outcomes) {}

    static InvocationObserver composite(InvocationObserver... observers) {
        List<InvocationObserver> delegates = List.of(observers);
        return new InvocationObserver() {
            @Override
            public void onInvocationStarted(InvocationRequest request) {
                delegates.forEach(o -> o.onInvocationStarted(request));
            }

            @Override
            public void onToolCall(InvocationRequest request, String toolName, ToolCallResult.Status status) {
                delegates.forEach(o -> o.onToolCall(request, toolName, status));
            }

            @Override
            public void onInvocationCompleted(InvocationOutcome outcome, long durationMs) {
                delegates.forEach(o -> o.onInvocationCompleted(outcome, durationMs));
            }

            @Override
            public void onBatchCompleted(List<InvocationOutcome> outcomes) {
                delegates.forEach(o -> o.onBatchCompleted(outcomes));
            }
        };
    }
}
