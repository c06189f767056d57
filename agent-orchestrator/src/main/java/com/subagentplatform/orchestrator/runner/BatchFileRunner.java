package com.subagentplatform.orchestrator.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.orchestrator.service.BatchReport;
import com.subagentplatform.orchestrator.service.OrchestratorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one batch from a JSON file when started with {@code --batch=<file.json>}.
 *
 * <p>The file holds an array of {@code {"agentName": ..., "taskPrompt": ..., "requestId": ...}}
 * entries; {@code requestId} is optional. Without the option the runner does nothing.
 */
@Component
public class BatchFileRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchFileRunner.class);

    public static final String BATCH_OPTION = "batch";

    private final OrchestratorService orchestratorService;
    private final ObjectMapper objectMapper;

    public BatchFileRunner(OrchestratorService orchestratorService, ObjectMapper objectMapper) {
        this.orchestratorService = orchestratorService;
        this.objectMapper        = objectMapper;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!args.containsOption(BATCH_OPTION) || args.getOptionValues(BATCH_OPTION).isEmpty()) {
            log.info("[BatchRunner] No --{} option given; nothing to run", BATCH_OPTION);
            return;
        }
        Path file = Path.of(args.getOptionValues(BATCH_OPTION).get(0));
        List<InvocationRequest> requests = readBatch(file);
        log.info("[BatchRunner] Submitting batch. file={} requests={}", file, requests.size());

        BatchReport report = orchestratorService.submitBatch(requests).block();
        if (report == null) {
            throw new IllegalStateException("Batch produced no report: " + file);
        }
        log.info("[BatchRunner] Signal: {}", objectMapper.writeValueAsString(report.signal()));
        log.info("[BatchRunner] Outcomes: {}", objectMapper.writerWithDefaultPrettyPrinter()
            .writeValueAsString(report.outcomes()));
        log.info("[BatchRunner] Stats: {}", objectMapper.writeValueAsString(report.stats()));
    }

    List<InvocationRequest> readBatch(Path file) throws IOException {
        List<BatchEntry> entries = objectMapper.readValue(Files.readAllBytes(file), new TypeReference<>() {});
        return entries.stream()
            .map(e -> e.requestId() == null || e.requestId().isBlank()
                ? InvocationRequest.of(e.agentName(), e.taskPrompt())
                : InvocationRequest.of(e.requestId(), e.agentName(), e.taskPrompt()))
            .toList();
    }

    record BatchEntry(
        @JsonProperty("requestId") String requestId,
        @JsonProperty("agentName") String agentName,
        @JsonProperty("taskPrompt") String taskPrompt
    ) {}
}
