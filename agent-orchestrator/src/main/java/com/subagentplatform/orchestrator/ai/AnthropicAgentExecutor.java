package com.subagentplatform.orchestrator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.subagentplatform.common.exception.AgentException;
import com.subagentplatform.common.exception.SchemaValidationException;
import com.subagentplatform.common.model.ToolCallResult;
import com.subagentplatform.orchestrator.executor.AgentExecutor;
import com.subagentplatform.orchestrator.executor.AgentInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link AgentExecutor} backed by the Anthropic Messages API.
 *
 * <p>Runs the tool-use loop: the profile's usable tools are declared to the model; every
 * {@code tool_use} block is routed through the invocation's
 * {@link com.subagentplatform.orchestrator.executor.ToolAuthorizer} and answered with a
 * {@code tool_result} block. Denied and failed calls are answered with {@code is_error} so the
 * model can adapt. The loop ends on a response without tool calls; its text must be the JSON
 * result object (markdown code fences are tolerated).
 *
 * <p>The conversation lives only inside one {@link #execute} call.
 */
public class AnthropicAgentExecutor implements AgentExecutor {

    private static final Logger log = LoggerFactory.getLogger(AnthropicAgentExecutor.class);

    static final String STOP_TOOL_USE = "tool_use";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String defaultModel;
    private final int maxTurns;

    public AnthropicAgentExecutor(WebClient anthropicClient, ObjectMapper objectMapper,
                                  String apiKey, String defaultModel, int maxTurns) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
        this.apiKey          = apiKey;
        this.defaultModel    = defaultModel;
        this.maxTurns        = maxTurns;
    }

    /** Builds the API client the way every Anthropic call in this service is configured. */
    public static WebClient anthropicClient(WebClient.Builder builder, String baseUrl) {
        return builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public Mono<JsonNode> execute(AgentInvocation invocation) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new AgentException(invocation.agentName(), "no Anthropic API key configured"));
        }
        String model = invocation.model() != null && !invocation.model().isBlank()
            ? invocation.model() : defaultModel;

        ArrayNode messages = objectMapper.createArrayNode();
        messages.addObject()
            .put("role", "user")
            .put("content", invocation.taskPrompt());

        log.debug("[Anthropic] Conversation started. agent={} requestId={} model={} tools={}",
                  invocation.agentName(), invocation.requestId(), model, invocation.availableTools().size());
        return converse(invocation, model, messages, 1);
    }

    private Mono<JsonNode> converse(AgentInvocation invocation, String model, ArrayNode messages, int turn) {
        if (turn > maxTurns) {
            return Mono.error(new AgentException(invocation.agentName(),
                "no final answer after " + maxTurns + " turns"));
        }
        return callMessagesApi(invocation, model, messages)
            .flatMap(response -> {
                JsonNode content = response.path("content");
                List<JsonNode> toolUses = blocksOfType(content, "tool_use");
                if (toolUses.isEmpty() || !STOP_TOOL_USE.equals(response.path("stop_reason").asText())) {
                    return Mono.fromCallable(() -> parseFinalAnswer(invocation, content));
                }

                messages.addObject()
                    .put("role", "assistant")
                    .set("content", content);

                return Flux.fromIterable(toolUses)
                    .concatMap(block -> answerToolUse(invocation, block))
                    .collectList()
                    .flatMap(results -> {
                        ObjectNode userTurn = messages.addObject().put("role", "user");
                        userTurn.putArray("content").addAll(results);
                        return converse(invocation, model, messages, turn + 1);
                    });
            });
    }

    private Mono<JsonNode> callMessagesApi(AgentInvocation invocation, String model, ArrayNode messages) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", invocation.maxContextTokens());
        body.put("system", invocation.systemPrompt());
        body.set("messages", messages.deepCopy());
        if (!invocation.availableTools().isEmpty()) {
            ArrayNode tools = body.putArray("tools");
            for (String toolName : invocation.availableTools()) {
                ObjectNode tool = tools.addObject();
                tool.put("name", toolName);
                tool.put("description", "Tool " + toolName);
                tool.putObject("input_schema").put("type", "object");
            }
        }

        return anthropicClient.post()
            .uri("/v1/messages")
            .header("x-api-key", apiKey)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class);
    }

    private Mono<JsonNode> answerToolUse(AgentInvocation invocation, JsonNode block) {
        String toolName = block.path("name").asText();
        String toolUseId = block.path("id").asText();
        JsonNode input = block.path("input").isMissingNode() ? objectMapper.createObjectNode() : block.path("input");

        return invocation.toolAuthorizer().call(toolName, input)
            .map(result -> {
                ObjectNode toolResult = objectMapper.createObjectNode();
                toolResult.put("type", "tool_result");
                toolResult.put("tool_use_id", toolUseId);
                if (result.isOk()) {
                    toolResult.put("content", result.payload() == null ? "null" : result.payload().toString());
                } else {
                    toolResult.put("content", describeFailure(result));
                    toolResult.put("is_error", true);
                }
                return toolResult;
            });
    }

    private static String describeFailure(ToolCallResult result) {
        return result.status() == ToolCallResult.Status.DENIED
            ? "Tool " + result.toolName() + " is not permitted: " + result.error()
            : "Tool " + result.toolName() + " failed: " + result.error();
    }

    private JsonNode parseFinalAnswer(AgentInvocation invocation, JsonNode content) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : blocksOfType(content, "text")) {
            text.append(block.path("text").asText());
        }
        String cleaned = extractJsonObject(text.toString());
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException(invocation.agentName(), "final answer is not JSON", text.toString(), e);
        }
    }

    /** Strips markdown fences and keeps the outermost {@code {...}} span. */
    static String extractJsonObject(String text) {
        String cleaned = text
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        return start >= 0 && end > start ? cleaned.substring(start, end + 1) : cleaned;
    }

    private static List<JsonNode> blocksOfType(JsonNode content, String type) {
        List<JsonNode> blocks = new ArrayList<>();
        if (content != null && content.isArray()) {
            for (JsonNode block : content) {
                if (type.equals(block.path("type").asText())) {
                    blocks.add(block);
                }
            }
        }
        return blocks;
    }
}
