package com.subagentplatform.orchestrator.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.subagentplatform.orchestrator.registry.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Forwards tool calls to the tool gateway: {@code POST /tools/{name}} with body
 * {@code {"tool": name, "input": {...}}}. The gateway's JSON response is the tool result.
 *
 * <p>MCP-qualified names are sent in canonical form. Non-2xx responses and timeouts surface
 * as errors on the returned {@code Mono}.
 */
public class HttpToolProvider implements ToolProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpToolProvider.class);

    private final WebClient toolGatewayClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpToolProvider(WebClient toolGatewayClient, ObjectMapper objectMapper, Duration timeout) {
        this.toolGatewayClient = toolGatewayClient;
        this.objectMapper      = objectMapper;
        this.timeout           = timeout;
    }

    @Override
    public Mono<JsonNode> invoke(String toolName, JsonNode input) {
        String canonical = ToolRegistry.canonicalName(toolName);
        ObjectNode body = objectMapper.createObjectNode();
        body.put("tool", canonical);
        body.set("input", input == null ? objectMapper.createObjectNode() : input);

        return toolGatewayClient.post()
            .uri("/tools/{name}", canonical)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .doOnSuccess(r -> log.debug("[ToolGateway] Call completed. tool={}", canonical))
            .doOnError(e -> log.warn("[ToolGateway] Call failed. tool={} reason={}", canonical, e.getMessage()));
    }
}
