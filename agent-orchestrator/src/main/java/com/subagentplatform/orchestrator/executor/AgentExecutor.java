package com.subagentplatform.orchestrator.executor;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Opaque, capability-bounded agent runtime (typically a language model with tool use).
 *
 * <p>Implementations must route every tool they use through
 * {@link AgentInvocation#toolAuthorizer()} and emit exactly one terminal payload, or an error.
 * They may block; the {@link InvocationExecutor} subscribes on a bounded elastic scheduler
 * and cancels on deadline.
 */
public interface AgentExecutor {

    Mono<JsonNode> execute(AgentInvocation invocation);
}
