package com.subagentplatform.orchestrator.executor;

import com.subagentplatform.common.exception.PolicyViolationException;
import com.subagentplatform.common.exception.SchemaValidationException;
import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.InvocationOutcome;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.orchestrator.dispatch.InvocationObserver;
import com.subagentplatform.orchestrator.policy.PolicyEnforcer;
import com.subagentplatform.orchestrator.tool.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Runs one agent call against the opaque {@link AgentExecutor}.
 *
 * <p>Per invocation:
 * <ol>
 *   <li>a fresh {@link ScopedToolAuthorizer} and {@link AgentInvocation} are built; nothing
 *       from earlier invocations of the same agent is visible</li>
 *   <li>the executor is subscribed on {@link Schedulers#boundedElastic()}</li>
 *   <li>the final payload is checked by {@link AgentResultValidator}</li>
 *   <li>the deadline bounds the whole attempt; when it fires first the outcome is
 *       {@code Timeout}, the executor is cancelled, and anything it emits later is dropped</li>
 * </ol>
 *
 * <p>The returned {@code Mono} always emits exactly one outcome and never errors.
 */
@Component
public class InvocationExecutor {

    private static final Logger log = LoggerFactory.getLogger(InvocationExecutor.class);

    private static final DateTimeFormatter SESSION_START_FMT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter CURRENT_TIME_FMT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final AgentExecutor agentExecutor;
    private final PolicyEnforcer policyEnforcer;
    private final ToolProvider toolProvider;
    private final Clock clock;

    public InvocationExecutor(AgentExecutor agentExecutor, PolicyEnforcer policyEnforcer,
                              ToolProvider toolProvider, Clock clock) {
        this.agentExecutor  = agentExecutor;
        this.policyEnforcer = policyEnforcer;
        this.toolProvider   = toolProvider;
        this.clock          = clock;
    }

    /** Runs with the profile's own {@code maxDurationMs} as deadline and no observer. */
    public Mono<InvocationOutcome> run(InvocationRequest request, AgentProfile profile) {
        return run(request, profile, Duration.ofMillis(profile.maxDurationMs()), InvocationObserver.NOOP);
    }

    public Mono<InvocationOutcome> run(InvocationRequest request, AgentProfile profile,
                                       Duration deadline, InvocationObserver observer) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            ScopedToolAuthorizer authorizer =
                new ScopedToolAuthorizer(request, profile, policyEnforcer, toolProvider, observer);
            AgentInvocation invocation = new AgentInvocation(
                request.requestId(),
                profile.name(),
                sessionSystemPrompt(profile, request),
                request.taskPrompt(),
                policyEnforcer.usableTools(profile),
                authorizer,
                profile.maxContextTokens(),
                profile.model());

            observer.onInvocationStarted(request);
            log.info("[Invocation] Started. agent={} requestId={} deadlineMs={}",
                     profile.name(), request.requestId(), deadline.toMillis());

            Mono<InvocationOutcome> attempt = Mono.defer(() -> agentExecutor.execute(invocation))
                .subscribeOn(Schedulers.boundedElastic())
                .map(payload -> (InvocationOutcome) new InvocationOutcome.Success(
                    request.requestId(), profile.name(),
                    AgentResultValidator.validate(profile, payload),
                    elapsedMs(startNanos)))
                .switchIfEmpty(Mono.fromSupplier(() -> new InvocationOutcome.ExecutorError(
                    request.requestId(), profile.name(), "executor completed without a payload")))
                .onErrorResume(e -> Mono.just(toFailure(request, profile, e)));

            return attempt
                .timeout(deadline, Mono.fromSupplier(() -> new InvocationOutcome.Timeout(
                    request.requestId(), profile.name(),
                    "exceeded maxDurationMs=" + deadline.toMillis())))
                .doOnNext(outcome -> {
                    authorizer.close();
                    long durationMs = elapsedMs(startNanos);
                    log.info("[Invocation] Completed. agent={} requestId={} outcome={} durationMs={}",
                             profile.name(), request.requestId(), outcome.kind(), durationMs);
                    observer.onInvocationCompleted(outcome, durationMs);
                })
                .doFinally(signal -> authorizer.close());
        });
    }

    private InvocationOutcome toFailure(InvocationRequest request, AgentProfile profile, Throwable error) {
        Throwable e = Exceptions.unwrap(error);
        if (e instanceof PolicyViolationException violation) {
            log.warn("[Invocation] Policy violation. agent={} requestId={} tool={} reason={}",
                     profile.name(), request.requestId(), violation.getToolName(), violation.getReason());
            return new InvocationOutcome.PolicyViolation(
                request.requestId(), profile.name(), violation.getToolName(), violation.getReason());
        }
        if (e instanceof SchemaValidationException invalid) {
            log.error("[Invocation] Malformed output. agent={} requestId={} reason={} payload={}",
                      profile.name(), request.requestId(), invalid.getMessage(), invalid.getPayload());
            return new InvocationOutcome.ExecutorError(request.requestId(), profile.name(), invalid.getMessage());
        }
        log.error("[Invocation] Executor failed. agent={} requestId={}", profile.name(), request.requestId(), e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return new InvocationOutcome.ExecutorError(request.requestId(), profile.name(), message);
    }

    /** Prefixes the profile prompt with the session start and current time. */
    private String sessionSystemPrompt(AgentProfile profile, InvocationRequest request) {
        return "Session Start Time: " + SESSION_START_FMT.format(request.submittedAt()) + "\n"
             + "Current UTC Time: " + CURRENT_TIME_FMT.format(clock.instant()) + "\n\n"
             + profile.systemPrompt();
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
