package com.subagentplatform.orchestrator.policy;

import com.subagentplatform.orchestrator.registry.ToolRegistry;

/**
 * Glob matching for tool allow-lists: {@code *} matches any run of characters (including
 * none), {@code ?} matches exactly one; everything else matches literally.
 */
public final class ToolPatternMatcher {

    private ToolPatternMatcher() {}

    /**
     * Matches an allow-list entry against a tool name in either its called or canonical form.
     * Literal MCP-qualified entries ({@code mcp__binance__binance_get_account}) also match the
     * bare name; wildcard entries are never canonicalized, so {@code mcp__polygon__*} stays
     * scoped to its server.
     */
    public static boolean matchesTool(String pattern, String toolName) {
        if (pattern == null || toolName == null) {
            return false;
        }
        String canonicalTool = ToolRegistry.canonicalName(toolName);
        if (matches(pattern, toolName) || matches(pattern, canonicalTool)) {
            return true;
        }
        boolean literal = pattern.indexOf('*') < 0 && pattern.indexOf('?') < 0;
        return literal && ToolRegistry.canonicalName(pattern).equals(canonicalTool);
    }

    public static boolean matches(String pattern, String toolName) {
        if (pattern == null || toolName == null) {
            return false;
        }
        int p = 0;
        int t = 0;
        int starP = -1;
        int starT = -1;
        while (t < toolName.length()) {
            if (p < pattern.length()
                    && (pattern.charAt(p) == '?' || pattern.charAt(p) == toolName.charAt(t))) {
                p++;
                t++;
            } else if (p < pattern.length() && pattern.charAt(p) == '*') {
                starP = p++;
                starT = t;
            } else if (starP >= 0) {
                // backtrack: let the last '*' absorb one more character
                p = starP + 1;
                t = ++starT;
            } else {
                return false;
            }
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') {
            p++;
        }
        return p == pattern.length();
    }
}
