package com.subagentplatform.orchestrator.registry;

import com.subagentplatform.common.exception.ProfileConfigurationException;
import com.subagentplatform.common.exception.UnknownToolException;
import com.subagentplatform.common.model.CapabilityTag;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static mapping of tool names to capability tags. Immutable after construction and shared
 * by every concurrent invocation without locking.
 *
 * <p>Tool names may arrive MCP-qualified ({@code mcp__binance__binance_get_account}); lookups
 * use the canonical bare name ({@code binance_get_account}).
 */
public class ToolRegistry {

    private static final String MCP_PREFIX = "mcp__";

    private final Map<String, CapabilityTag> capabilities;
    private final Set<CapabilityTag> knownCapabilities;

    public ToolRegistry(Map<String, CapabilityTag> toolCapabilities, Set<CapabilityTag> knownCapabilities) {
        Map<String, CapabilityTag> table = new HashMap<>();
        toolCapabilities.forEach((tool, capability) -> {
            if (tool == null || tool.isBlank()) {
                throw new ProfileConfigurationException("Tool registry contains a blank tool name");
            }
            CapabilityTag previous = table.put(canonicalName(tool), capability);
            if (previous != null && previous != capability) {
                throw new ProfileConfigurationException(
                    "Tool " + tool + " mapped to both " + previous + " and " + capability);
            }
        });
        this.capabilities = Collections.unmodifiableMap(table);
        EnumSet<CapabilityTag> known = EnumSet.noneOf(CapabilityTag.class);
        known.addAll(knownCapabilities);
        known.addAll(table.values());
        this.knownCapabilities = Collections.unmodifiableSet(known);
    }

    /**
     * Builds the registry from the configured {@code capability label → tool names} table.
     * An unknown capability label is a configuration error.
     */
    public static ToolRegistry fromDefinitions(Map<String, List<String>> toolsByCapability) {
        Map<String, CapabilityTag> table = new HashMap<>();
        EnumSet<CapabilityTag> declared = EnumSet.noneOf(CapabilityTag.class);
        toolsByCapability.forEach((label, tools) -> {
            CapabilityTag capability;
            try {
                capability = CapabilityTag.fromLabel(label);
            } catch (IllegalArgumentException e) {
                throw new ProfileConfigurationException("Tool registry declares unknown capability: " + label, e);
            }
            declared.add(capability);
            if (tools == null) {
                return;
            }
            for (String tool : tools) {
                if (tool == null || tool.isBlank()) {
                    throw new ProfileConfigurationException("Blank tool name under capability " + label);
                }
                CapabilityTag previous = table.put(canonicalName(tool), capability);
                if (previous != null && previous != capability) {
                    throw new ProfileConfigurationException(
                        "Tool " + tool + " mapped to both " + previous + " and " + capability);
                }
            }
        });
        return new ToolRegistry(table, declared);
    }

    /**
     * @throws UnknownToolException if no mapping exists for the tool
     */
    public CapabilityTag resolveCapability(String toolName) {
        CapabilityTag capability = toolName == null ? null : capabilities.get(canonicalName(toolName));
        if (capability == null) {
            throw new UnknownToolException(toolName);
        }
        return capability;
    }

    public boolean isKnown(String toolName) {
        return toolName != null && capabilities.containsKey(canonicalName(toolName));
    }

    public Set<CapabilityTag> knownCapabilities() {
        return knownCapabilities;
    }

    /** Canonical names of every registered tool. */
    public Set<String> toolNames() {
        return capabilities.keySet();
    }

    /** Strips an {@code mcp__<server>__} qualifier, if present. */
    public static String canonicalName(String toolName) {
        String trimmed = toolName.trim();
        if (!trimmed.startsWith(MCP_PREFIX)) {
            return trimmed;
        }
        int serverEnd = trimmed.indexOf("__", MCP_PREFIX.length());
        if (serverEnd < 0 || serverEnd + 2 >= trimmed.length()) {
            return trimmed;
        }
        return trimmed.substring(serverEnd + 2);
    }
}
