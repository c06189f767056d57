package com.subagentplatform.orchestrator.dispatch;

import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.common.model.ToolCallResult;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * {@link InvocationObserver} that counts per-agent invocations, outcome kinds, durations and
 * tool calls for one batch. Create one per batch; read it with {@link #snapshot()}.
 */
public class InvocationStatsRecorder implements InvocationObserver {

    private final Map<String, AgentCounters> agents = new ConcurrentHashMap<>();
    private final Set<String> running = ConcurrentHashMap.newKeySet();
    private final AtomicInteger peakConcurrency = new AtomicInteger();

    @Override
    public void onInvocationStarted(InvocationRequest request) {
        counters(request.agentName()).invocations.increment();
        running.add(request.requestId());
        peakConcurrency.accumulateAndGet(running.size(), Math::max);
    }

    @Override
    public void onToolCall(InvocationRequest request, String toolName, ToolCallResult.Status status) {
        counters(request.agentName()).toolCalls
            .computeIfAbsent(toolName, t -> new ConcurrentHashMap<>())
            .computeIfAbsent(status.name(), s -> new LongAdder())
            .increment();
    }

    @Override
    public void onInvocationCompleted(InvocationOutcome outcome, long durationMs) {
        AgentCounters c = counters(outcome.agentName());
        c.outcomes.computeIfAbsent(outcome.kind(), k -> new LongAdder()).increment();
        if (durationMs > 0) {
            c.totalDurationMs.add(durationMs);
            c.maxDurationMs.accumulateAndGet(durationMs, Math::max);
        }
        running.remove(outcome.requestId());
    }

    public InvocationStats snapshot() {
        Map<String, InvocationStats.AgentStats> result = new TreeMap<>();
        agents.forEach((name, c) -> {
            Map<String, Long> outcomes = new TreeMap<>();
            c.outcomes.forEach((kind, n) -> outcomes.put(kind, n.sum()));
            Map<String, Map<String, Long>> tools = new TreeMap<>();
            c.toolCalls.forEach((tool, byStatus) -> {
                Map<String, Long> counts = new TreeMap<>();
                byStatus.forEach((status, n) -> counts.put(status, n.sum()));
                tools.put(tool, counts);
            });
            result.put(name, new InvocationStats.AgentStats(
                c.invocations.sum(), outcomes, c.totalDurationMs.sum(), c.maxDurationMs.get(), tools));
        });
        return new InvocationStats(result, peakConcurrency.get());
    }

    private AgentCounters counters(String agentName) {
        return agents.computeIfAbsent(agentName, n -> new AgentCounters());
    }

    private static final class AgentCounters {
        final LongAdder invocations = new LongAdder();
        final LongAdder totalDurationMs = new LongAdder();
        final AtomicLong maxDurationMs = new AtomicLong();
        final Map<String, LongAdder> outcomes = new ConcurrentHashMap<>();
        final Map<String, Map<String, LongAdder>> toolCalls = new ConcurrentHashMap<>();
    }
}
