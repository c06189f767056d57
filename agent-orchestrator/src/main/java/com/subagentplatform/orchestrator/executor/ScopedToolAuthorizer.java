package com.subagentplatform.orchestrator.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.subagentplatform.common.exception.PolicyViolationException;
import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.InvocationRequest;
import com.subagentplatform.common.model.PolicyDecision;
import com.subagentplatform.common.model.ToolCallResult;
import com.subagentplatform.orchestrator.dispatch.InvocationObserver;
import com.subagentplatform.orchestrator.policy.PolicyEnforcer;
import com.subagentplatform.orchestrator.tool.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ToolAuthorizer} bound to a single invocation. Once the invocation reaches a terminal
 * outcome the authorizer is closed and denies everything, so a timed-out agent that keeps
 * running cannot reach a tool provider.
 */
class ScopedToolAuthorizer implements ToolAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(ScopedToolAuthorizer.class);

    static final String REASON_CLOSED = "invocation already terminated";

    private final InvocationRequest request;
    private final AgentProfile profile;
    private final PolicyEnforcer policyEnforcer;
    private final ToolProvider toolProvider;
    private final InvocationObserver observer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ScopedToolAuthorizer(InvocationRequest request, AgentProfile profile, PolicyEnforcer policyEnforcer,
                         ToolProvider toolProvider, InvocationObserver observer) {
        this.request        = request;
        this.profile        = profile;
        this.policyEnforcer = policyEnforcer;
        this.toolProvider   = toolProvider;
        this.observer       = observer;
    }

    @Override
    public PolicyDecision authorize(String toolName) {
        if (closed.get()) {
            return PolicyDecision.deny(REASON_CLOSED);
        }
        return policyEnforcer.authorize(profile, toolName);
    }

    @Override
    public Mono<ToolCallResult> call(String toolName, JsonNode input) {
        return Mono.defer(() -> {
            PolicyDecision decision = authorize(toolName);
            if (decision instanceof PolicyDecision.Deny deny) {
                observer.onToolCall(request, toolName, ToolCallResult.Status.DENIED);
                return Mono.just(ToolCallResult.denied(toolName, deny.reason()));
            }
            return Mono.defer(() -> toolProvider.invoke(toolName, input))
                .defaultIfEmpty(NullNode.getInstance())
                .map(payload -> ToolCallResult.ok(toolName, payload))
                .onErrorResume(e -> {
                    log.warn("[Tool] Provider call failed. agent={} tool={} requestId={} reason={}",
                             profile.name(), toolName, request.requestId(), e.getMessage());
                    return Mono.just(ToolCallResult.failed(toolName, String.valueOf(e.getMessage())));
                })
                .doOnNext(result -> observer.onToolCall(request, toolName, result.status()));
        });
    }

    @Override
    public void requireAllowed(String toolName) {
        PolicyDecision decision = authorize(toolName);
        if (decision instanceof PolicyDecision.Deny deny) {
            observer.onToolCall(request, toolName, ToolCallResult.Status.DENIED);
            throw new PolicyViolationException(profile.name(), toolName, deny.reason());
        }
    }

    void close() {
        closed.set(true);
    }

    boolean isClosed() {
        return closed.get();
    }
}
