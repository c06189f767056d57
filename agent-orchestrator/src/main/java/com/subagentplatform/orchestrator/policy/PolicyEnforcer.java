package com.subagentplatform.orchestrator.policy;

import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.CapabilityTag;
import com.subagentplatform.common.model.PolicyDecision;
import com.subagentplatform.orchestrator.registry.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides, for every individual tool call an agent attempts, whether that call may proceed.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Resolve the tool's capability via the {@link ToolRegistry}. An unregistered tool is
 *       denied, not raised.</li>
 *   <li>Capability listed in {@code deniedCapabilities} → Deny, whatever the patterns say.</li>
 *   <li>Tool name matches any {@code allowedToolPatterns} entry → Allow.</li>
 *   <li>Otherwise → Deny("not in allow-list").</li>
 * </ol>
 *
 * <p>Patterns are tried against both the name as called and its canonical (MCP-stripped) form,
 * see {@link ToolPatternMatcher#matchesTool}. Stateless apart from the immutable registry; safe for concurrent use.
 */
@Component
public class PolicyEnforcer {

    private static final Logger log = LoggerFactory.getLogger(PolicyEnforcer.class);

    public static final String REASON_NOT_ALLOWED = "not in allow-list";
    public static final String REASON_UNKNOWN_TOOL = "unknown tool";

    private final ToolRegistry toolRegistry;

    public PolicyEnforcer(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    public PolicyDecision authorize(AgentProfile profile, String toolName) {
        PolicyDecision decision = decide(profile, toolName);
        if (decision instanceof PolicyDecision.Deny deny) {
            log.warn("[Policy] Deny agent={} tool={} reason={}", profile.name(), toolName, deny.reason());
        } else {
            log.debug("[Policy] Allow agent={} tool={}", profile.name(), toolName);
        }
        return decision;
    }

    /**
     * Registered tools this profile may call, sorted by name. This is the tool surface declared
     * to the executing agent; each call is still authorized individually.
     */
    public List<String> usableTools(AgentProfile profile) {
        return toolRegistry.toolNames().stream()
            .filter(tool -> decide(profile, tool).allowed())
            .sorted()
            .toList();
    }

    private PolicyDecision decide(AgentProfile profile, String toolName) {
        if (!toolRegistry.isKnown(toolName)) {
            return PolicyDecision.deny(REASON_UNKNOWN_TOOL);
        }
        CapabilityTag capability = toolRegistry.resolveCapability(toolName);

        if (profile.denies(capability)) {
            return PolicyDecision.deny("capability " + capability.label() + " is denied for this agent");
        }

        for (String pattern : profile.allowedToolPatterns()) {
            if (ToolPatternMatcher.matchesTool(pattern, toolName)) {
                return PolicyDecision.allow();
            }
        }
        return PolicyDecision.deny(REASON_NOT_ALLOWED);
    }
}
