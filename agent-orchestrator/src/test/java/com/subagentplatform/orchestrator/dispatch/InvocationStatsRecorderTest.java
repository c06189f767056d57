package com.subagentplatform.orchestrator.dispatch;

import com.subagentplatform.common.model.AgentResult;
import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.common.model.Sentiment;
import com.subagentplatform.common.model.ToolCallResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InvocationStatsRecorderTest {

    @Test
    @DisplayName("counts invocations, outcomes, durations and tool calls per agent")
    void recordsPerAgent() {
        InvocationStatsRecorder recorder = new InvocationStatsRecorder();
        InvocationRequest r1 = InvocationRequest.of("r1", "news-analyst", "a");
        InvocationRequest r2 = InvocationRequest.of("r2", "news-analyst", "b");

        recorder.onInvocationStarted(r1);
        recorder.onInvocationStarted(r2);
        recorder.onToolCall(r1, "polygon_news", ToolCallResult.Status.OK);
        recorder.onToolCall(r1, "polygon_news", ToolCallResult.Status.OK);
        recorder.onToolCall(r2, "binance_spot_market_order", ToolCallResult.Status.DENIED);
        recorder.onInvocationCompleted(new InvocationOutcome.Success("r1", "news-analyst",
            new AgentResult(Sentiment.BULLISH, 0.7, "s", List.of(), null), 120), 120);
        recorder.onInvocationCompleted(new InvocationOutcome.Timeout("r2", "news-analyst", "slow"), 300);

        InvocationStats.AgentStats stats = recorder.snapshot().forAgent("news-analyst");
        assertEquals(2, stats.invocations());
        assertEquals(1, stats.outcomeCount("SUCCESS"));
        assertEquals(1, stats.outcomeCount("TIMEOUT"));
        assertEquals(0, stats.outcomeCount("EXECUTOR_ERROR"));
        assertEquals(420, stats.totalDurationMs());
        assertEquals(300, stats.maxDurationMs());
        assertEquals(2, stats.toolCallCount("polygon_news", "OK"));
        assertEquals(1, stats.toolCallCount("binance_spot_market_order", "DENIED"));
        assertEquals(2, recorder.snapshot().peakConcurrency());
    }

    @Test
    @DisplayName("requests that never started add no duration")
    void neverStarted() {
        InvocationStatsRecorder recorder = new InvocationStatsRecorder();
        recorder.onInvocationCompleted(new InvocationOutcome.ExecutorError("r1", "oracle", "Unknown agent: oracle"), 0);

        InvocationStats.AgentStats stats = recorder.snapshot().forAgent("oracle");
        assertEquals(0, stats.invocations());
        assertEquals(1, stats.outcomeCount("EXECUTOR_ERROR"));
        assertEquals(0, stats.totalDurationMs());
    }

    @Test
    @DisplayName("separate recorders share nothing")
    void perBatchIsolation() {
        InvocationStatsRecorder first = new InvocationStatsRecorder();
        InvocationStatsRecorder second = new InvocationStatsRecorder();
        first.onInvocationStarted(InvocationRequest.of("r1", "trader", "buy"));

        assertNotNull(first.snapshot().forAgent("trader"));
        assertNull(second.snapshot().forAgent("trader"));
        assertEquals(InvocationStats.empty(), second.snapshot());
    }
}
