package com.subagentplatform.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externally supplied tool table and subagent profile definitions, bound from the
 * {@code subagents} prefix of {@code application.yml}.
 */
@Data
@ConfigurationProperties(prefix = "subagents")
public class SubagentProperties {

    /** Capability label → tool names carrying that capability. */
    private Map<String, List<String>> tools = new LinkedHashMap<>();

    /** One entry per subagent. */
    private List<ProfileDefinition> profiles = new ArrayList<>();

    private Dispatch dispatch = new Dispatch();

    @Data
    public static class ProfileDefinition {
        private String name;
        private String description;
        private String systemPrompt;
        /** Glob patterns matched against tool names, e.g. {@code polygon_*}. */
        private List<String> allowedTools = new ArrayList<>();
        /** Capability labels this agent may never use, whatever its patterns say. */
        private List<String> deniedCapabilities = new ArrayList<>();
        private Long maxDurationMs = 60_000L;
        private Integer maxContextTokens = 4096;
        /** Extra required result keys; sentiment, confidence and summary are always required. */
        private List<String> outputSchema = new ArrayList<>();
        private String model;
    }

    @Data
    public static class Dispatch {
        /** Concurrent invocations per batch when the caller does not say. */
        private Integer defaultConcurrency = 3;
        /** Batch-level ceiling in ms; 0 or less means wait for every invocation. */
        private Long defaultBatchDeadlineMs = 0L;
    }
}
