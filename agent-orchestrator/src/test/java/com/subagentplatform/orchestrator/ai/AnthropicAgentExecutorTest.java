package com.subagentplatform.orchestrator.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.subagentplatform.common.exception.AgentException;
import com.subagentplatform.common.exception.SchemaValidationException;
import com.subagentplatform.common.model.PolicyDecision;
import com.subagentplatform.common.model.ToolCallResult;
import com.subagentplatform.orchestrator.executor.AgentInvocation;
import com.subagentplatform.orchestrator.executor.ToolAuthorizer;
import com.subagentplatform.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicAgentExecutorTest {

    private static final String TOOL_USE = """
        {"stop_reason": "tool_use",
         "content": [
           {"type": "text", "text": "Checking news first."},
           {"type": "tool_use", "id": "toolu_1", "name": "polygon_news", "input": {"ticker": "X:BTCUSD"}},
           {"type": "tool_use", "id": "toolu_2", "name": "binance_spot_market_order", "input": {"side": "BUY"}}
         ]}
        """;

    private static final String FINAL_ANSWER = """
        {"stop_reason": "end_turn",
         "content": [{"type": "text",
                      "text": "```json\\n{\\"sentiment\\": \\"bullish\\", \\"confidence\\": 0.7, \\"summary\\": \\"ETF inflows\\"}\\n```"}]}
        """;

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    private WebClient scriptedClient(String... responses) {
        AtomicInteger next = new AtomicInteger();
        return WebClient.builder()
            .baseUrl("https://anthropic.test")
            .exchangeFunction(request -> {
                requests.add(request);
                String body = responses[Math.min(next.getAndIncrement(), responses.length - 1)];
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
    }

    private static AgentInvocation invocation(ToolAuthorizer authorizer) {
        return new AgentInvocation("r1", "news-analyst", "You are news-analyst.", "assess BTC",
            List.of("polygon_news"), authorizer, 1024, null);
    }

    /** Allows polygon_* and records every call. */
    private static final class RecordingAuthorizer implements ToolAuthorizer {
        final List<String> calls = new CopyOnWriteArrayList<>();

        @Override
        public PolicyDecision authorize(String toolName) {
            return toolName.startsWith("polygon_") ? PolicyDecision.allow() : PolicyDecision.deny("not in allow-list");
        }

        @Override
        public Mono<ToolCallResult> call(String toolName, JsonNode input) {
            calls.add(toolName);
            if (authorize(toolName) instanceof PolicyDecision.Deny deny) {
                return Mono.just(ToolCallResult.denied(toolName, deny.reason()));
            }
            return Mono.just(ToolCallResult.ok(toolName, TestFixtures.MAPPER.createObjectNode().put("headline", "ETF")));
        }

        @Override
        public void requireAllowed(String toolName) {
            throw new UnsupportedOperationException();
        }
    }

    @Nested
    @DisplayName("execute(): tool-use loop")
    class Loop {

        @Test
        @DisplayName("tool_use turn then fenced JSON answer → parsed payload, every tool routed through the authorizer")
        void toolUseThenAnswer() {
            RecordingAuthorizer authorizer = new RecordingAuthorizer();
            AnthropicAgentExecutor executor = new AnthropicAgentExecutor(
                scriptedClient(TOOL_USE, FINAL_ANSWER), TestFixtures.MAPPER, "sk-test", "claude-test", 8);

            StepVerifier.create(executor.execute(invocation(authorizer)))
                .assertNext(payload -> {
                    assertEquals("bullish", payload.get("sentiment").asText());
                    assertEquals(0.7, payload.get("confidence").asDouble());
                })
                .verifyComplete();

            assertEquals(List.of("polygon_news", "binance_spot_market_order"), authorizer.calls);
            assertEquals(2, requests.size());
            assertEquals("/v1/messages", requests.get(0).url().getPath());
            assertEquals("sk-test", requests.get(0).headers().getFirst("x-api-key"));
        }

        @Test
        @DisplayName("answer that is not JSON → SchemaValidationException")
        void notJson() {
            String prose = """
                {"stop_reason": "end_turn", "content": [{"type": "text", "text": "I think it goes up."}]}
                """;
            AnthropicAgentExecutor executor = new AnthropicAgentExecutor(
                scriptedClient(prose), TestFixtures.MAPPER, "sk-test", "claude-test", 8);

            StepVerifier.create(executor.execute(invocation(new RecordingAuthorizer())))
                .expectError(SchemaValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("model keeps calling tools past the turn cap → AgentException")
        void turnCap() {
            AnthropicAgentExecutor executor = new AnthropicAgentExecutor(
                scriptedClient(TOOL_USE), TestFixtures.MAPPER, "sk-test", "claude-test", 2);

            StepVerifier.create(executor.execute(invocation(new RecordingAuthorizer())))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(AgentException.class, e);
                    assertTrue(e.getMessage().contains("2 turns"));
                })
                .verify();
            assertEquals(2, requests.size());
        }
    }

    @Test
    @DisplayName("no API key → AgentException without any HTTP call")
    void missingKey() {
        AnthropicAgentExecutor executor = new AnthropicAgentExecutor(
            scriptedClient(FINAL_ANSWER), TestFixtures.MAPPER, "", "claude-test", 8);

        StepVerifier.create(executor.execute(invocation(new RecordingAuthorizer())))
            .expectError(AgentException.class)
            .verify();
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("extractJsonObject() strips fences and surrounding prose")
    void extractJson() {
        assertEquals("{\"a\":1}", AnthropicAgentExecutor.extractJsonObject("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":{\"b\":2}}", AnthropicAgentExecutor.extractJsonObject("Result: {\"a\":{\"b\":2}} done"));
        assertEquals("no json", AnthropicAgentExecutor.extractJsonObject("no json"));
    }
}
