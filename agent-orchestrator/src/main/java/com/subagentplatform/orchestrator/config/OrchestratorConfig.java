package com.subagentplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.subagentplatform.common.consensus.ConfidenceWeightedConsensusStrategy;
import com.subagentplatform.common.consensus.ConsensusEngine;
import com.subagentplatform.orchestrator.ai.AnthropicAgentExecutor;
import com.subagentplatform.orchestrator.executor.AgentExecutor;
import com.subagentplatform.orchestrator.profile.AgentProfileStore;
import com.subagentplatform.orchestrator.registry.ToolRegistry;
import com.subagentplatform.orchestrator.tool.HttpToolProvider;
import com.subagentplatform.orchestrator.tool.ToolProvider;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${tools.gateway.base-url}")
    private String toolGatewayUrl;

    @Value("${tools.gateway.timeout-ms:10000}")
    private long toolGatewayTimeoutMs;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicUrl;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.default-model:claude-sonnet-4-20250514}")
    private String anthropicDefaultModel;

    @Value("${anthropic.max-turns:8}")
    private int anthropicMaxTurns;

    @Value("${anthropic.timeout-ms:120000}")
    private long anthropicTimeoutMs;

    @Bean
    public ToolRegistry toolRegistry(SubagentProperties properties) {
        return ToolRegistry.fromDefinitions(properties.getTools());
    }

    @Bean
    public AgentProfileStore agentProfileStore(SubagentProperties properties, ToolRegistry toolRegistry) {
        return AgentProfileStore.fromDefinitions(properties.getProfiles(), toolRegistry);
    }

    @Bean
    public WebClient toolGatewayClient(WebClient.Builder builder) {
        return builder
            .baseUrl(toolGatewayUrl)
            .clientConnector(connector(Duration.ofMillis(toolGatewayTimeoutMs)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ToolProvider toolProvider(WebClient toolGatewayClient, ObjectMapper objectMapper) {
        return new HttpToolProvider(toolGatewayClient, objectMapper, Duration.ofMillis(toolGatewayTimeoutMs));
    }

    @Bean
    public AgentExecutor agentExecutor(WebClient.Builder builder, ObjectMapper objectMapper) {
        builder.clientConnector(connector(Duration.ofMillis(anthropicTimeoutMs)));
        return new AnthropicAgentExecutor(AnthropicAgentExecutor.anthropicClient(builder, anthropicUrl),
                                          objectMapper, anthropicApiKey, anthropicDefaultModel, anthropicMaxTurns);
    }

    @Bean
    public ConsensusEngine consensusEngine() {
        return new ConfidenceWeightedConsensusStrategy();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    private static ReactorClientHttpConnector connector(Duration responseTimeout) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(responseTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeout.toMillis(), TimeUnit.MILLISECONDS))
            );
        return new ReactorClientHttpConnector(httpClient);
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[ToolGateway] Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
