package com.subagentplatform.orchestrator.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolPatternMatcherTest {

    @Nested
    @DisplayName("matches(): glob semantics")
    class Glob {

        @Test
        @DisplayName("literal pattern matches only itself")
        void literal() {
            assertTrue(ToolPatternMatcher.matches("binance_get_ticker", "binance_get_ticker"));
            assertFalse(ToolPatternMatcher.matches("binance_get_ticker", "binance_get_tickers"));
        }

        @Test
        @DisplayName("* matches any run, including empty")
        void star() {
            assertTrue(ToolPatternMatcher.matches("polygon_*", "polygon_news"));
            assertTrue(ToolPatternMatcher.matches("polygon_*", "polygon_"));
            assertTrue(ToolPatternMatcher.matches("binance_*_order", "binance_spot_market_order"));
            assertTrue(ToolPatternMatcher.matches("*", "anything"));
            assertFalse(ToolPatternMatcher.matches("polygon_*", "binance_get_ticker"));
        }

        @Test
        @DisplayName("? matches exactly one character")
        void question() {
            assertTrue(ToolPatternMatcher.matches("polygon_crypto_?ma", "polygon_crypto_ema"));
            assertTrue(ToolPatternMatcher.matches("polygon_crypto_?ma", "polygon_crypto_sma"));
            assertFalse(ToolPatternMatcher.matches("polygon_crypto_?ma", "polygon_crypto_ma"));
        }

        @Test
        @DisplayName("backtracking across repeated segments")
        void backtracking() {
            assertTrue(ToolPatternMatcher.matches("*_notes", "binance_save_tool_notes_notes"));
            assertFalse(ToolPatternMatcher.matches("a*b*c", "aXbXd"));
        }

        @Test
        @DisplayName("null inputs never match")
        void nulls() {
            assertFalse(ToolPatternMatcher.matches(null, "x"));
            assertFalse(ToolPatternMatcher.matches("x", null));
        }
    }

    @Nested
    @DisplayName("matchesTool(): MCP-qualified names")
    class Qualified {

        @Test
        @DisplayName("bare pattern matches qualified tool")
        void bareVsQualified() {
            assertTrue(ToolPatternMatcher.matchesTool("polygon_*", "mcp__polygon__polygon_news"));
        }

        @Test
        @DisplayName("qualified literal pattern matches bare tool")
        void qualifiedLiteralVsBare() {
            assertTrue(ToolPatternMatcher.matchesTool("mcp__binance__binance_get_account", "binance_get_account"));
        }

        @Test
        @DisplayName("qualified wildcard stays scoped to its server")
        void qualifiedWildcard() {
            assertTrue(ToolPatternMatcher.matchesTool("mcp__polygon__*", "mcp__polygon__polygon_news"));
            assertFalse(ToolPatternMatcher.matchesTool("mcp__polygon__*", "mcp__binance__binance_get_account"));
            assertFalse(ToolPatternMatcher.matchesTool("mcp__polygon__*", "binance_get_account"));
        }
    }
}
