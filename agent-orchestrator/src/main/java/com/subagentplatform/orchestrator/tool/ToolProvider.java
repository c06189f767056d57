package com.subagentplatform.orchestrator.tool;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Backend reachable by agents only through their invocation's
 * {@link com.subagentplatform.orchestrator.executor.ToolAuthorizer}.
 *
 * <p>A provider-side error is signalled as an error on the returned {@code Mono}; callers
 * turn it into a failed tool call, never into an orchestrator fault.
 */
public interface ToolProvider {

    Mono<JsonNode> invoke(String toolName, JsonNode input);
}
