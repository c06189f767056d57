package com.subagentplatform.orchestrator.profile;

import com.subagentplatform.common.exception.ProfileConfigurationException;
import com.subagentplatform.common.exception.UnknownAgentException;
import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.CapabilityTag;
import com.subagentplatform.orchestrator.config.SubagentProperties.ProfileDefinition;
import com.subagentplatform.orchestrator.policy.ToolPatternMatcher;
import com.subagentplatform.orchestrator.registry.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only catalogue of subagent profiles, validated once at load time.
 *
 * <p>Load-time rules, each a {@link ProfileConfigurationException}:
 * <ul>
 *   <li>names are non-blank and unique</li>
 *   <li>every denied capability is known to the {@link ToolRegistry}</li>
 *   <li>{@code allowedToolPatterns} is non-empty and reaches at least one registered tool
 *       whose capability is not denied; an agent with zero usable tools is rejected here,
 *       not at call time</li>
 *   <li>{@code maxDurationMs} and {@code maxContextTokens} are positive</li>
 * </ul>
 */
public class AgentProfileStore {

    private static final Logger log = LoggerFactory.getLogger(AgentProfileStore.class);

    private final Map<String, AgentProfile> profiles;

    public AgentProfileStore(Collection<AgentProfile> profiles, ToolRegistry toolRegistry) {
        Map<String, AgentProfile> byName = new LinkedHashMap<>();
        for (AgentProfile profile : profiles) {
            validate(profile, toolRegistry);
            if (byName.putIfAbsent(profile.name(), profile) != null) {
                throw new ProfileConfigurationException("Duplicate agent profile: " + profile.name());
            }
        }
        this.profiles = Collections.unmodifiableMap(byName);
        log.info("[ProfileStore] Loaded {} agent profiles: {}", byName.size(), byName.keySet());
    }

    /**
     * Converts externally supplied definitions into validated profiles.
     */
    public static AgentProfileStore fromDefinitions(List<ProfileDefinition> definitions, ToolRegistry toolRegistry) {
        return new AgentProfileStore(definitions.stream().map(AgentProfileStore::toProfile).toList(), toolRegistry);
    }

    /**
     * @throws UnknownAgentException if no profile is registered under {@code agentName}
     */
    public AgentProfile getProfile(String agentName) {
        AgentProfile profile = agentName == null ? null : profiles.get(agentName);
        if (profile == null) {
            throw new UnknownAgentException(agentName);
        }
        return profile;
    }

    public Set<String> profileNames() {
        return profiles.keySet();
    }

    public Collection<AgentProfile> profiles() {
        return profiles.values();
    }

    private static AgentProfile toProfile(ProfileDefinition def) {
        Set<CapabilityTag> denied = EnumSet.noneOf(CapabilityTag.class);
        for (String label : def.getDeniedCapabilities()) {
            try {
                denied.add(CapabilityTag.fromLabel(label));
            } catch (IllegalArgumentException e) {
                throw new ProfileConfigurationException(
                    "Agent " + def.getName() + " denies unknown capability: " + label, e);
            }
        }
        return new AgentProfile(
            def.getName(),
            def.getDescription(),
            def.getSystemPrompt(),
            new LinkedHashSet<>(def.getAllowedTools()),
            denied,
            def.getMaxDurationMs() == null ? 0L : def.getMaxDurationMs(),
            def.getMaxContextTokens() == null ? 0 : def.getMaxContextTokens(),
            new LinkedHashSet<>(def.getOutputSchema()),
            def.getModel());
    }

    private static void validate(AgentProfile profile, ToolRegistry toolRegistry) {
        String name = profile.name();
        if (name == null || name.isBlank()) {
            throw new ProfileConfigurationException("Agent profile without a name");
        }
        for (CapabilityTag capability : profile.deniedCapabilities()) {
            if (!toolRegistry.knownCapabilities().contains(capability)) {
                throw new ProfileConfigurationException(
                    "Agent " + name + " denies capability unknown to the tool registry: " + capability);
            }
        }
        if (profile.allowedToolPatterns().isEmpty()) {
            throw new ProfileConfigurationException("Agent " + name + " has an empty tool allow-list");
        }
        boolean anyUsable = toolRegistry.toolNames().stream()
            .filter(tool -> !profile.denies(toolRegistry.resolveCapability(tool)))
            .anyMatch(tool -> profile.allowedToolPatterns().stream()
                .anyMatch(pattern -> ToolPatternMatcher.matchesTool(pattern, tool)));
        if (!anyUsable) {
            throw new ProfileConfigurationException(
                "Agent " + name + " has no usable tools: patterns " + profile.allowedToolPatterns()
                + " match no registered tool outside its denied capabilities");
        }
        if (profile.maxDurationMs() <= 0) {
            throw new ProfileConfigurationException("Agent " + name + " needs a positive maxDurationMs");
        }
        if (profile.maxContextTokens() <= 0) {
            throw new ProfileConfigurationException("Agent " + name + " needs a positive maxContextTokens");
        }
    }
}
