package com.subagentplatform.orchestrator.policy;

import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.CapabilityTag;
import com.subagentplatform.common.model.PolicyDecision;
import com.subagentplatform.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PolicyEnforcerTest {

    private final PolicyEnforcer enforcer = new PolicyEnforcer(TestFixtures.registry());

    private static String reason(PolicyDecision decision) {
        return ((PolicyDecision.Deny) decision).reason();
    }

    @Nested
    @DisplayName("authorize(): precedence")
    class Precedence {

        @Test
        @DisplayName("denied capability wins over a matching pattern")
        void denyWins() {
            AgentProfile risk = TestFixtures.riskManager(1_000);
            PolicyDecision decision = enforcer.authorize(risk, "binance_spot_market_order");
            assertFalse(decision.allowed());
            assertTrue(reason(decision).contains("execute-trade"));
        }

        @Test
        @DisplayName("same agent may still use an allowed read tool")
        void readAllowed() {
            AgentProfile risk = TestFixtures.riskManager(1_000);
            assertTrue(enforcer.authorize(risk, "binance_get_account").allowed());
            assertTrue(enforcer.authorize(risk, "mcp__binance__binance_get_account").allowed());
        }

        @Test
        @DisplayName("registered tool outside the allow-list → not in allow-list")
        void notInAllowList() {
            AgentProfile analyst = TestFixtures.analyst("news-analyst", 1_000);
            PolicyDecision decision = enforcer.authorize(analyst, "perplexity_sonar");
            assertFalse(decision.allowed());
            assertEquals(PolicyEnforcer.REASON_NOT_ALLOWED, reason(decision));
        }

        @Test
        @DisplayName("unregistered tool → unknown tool, even under a catch-all pattern")
        void unknownTool() {
            AgentProfile open = TestFixtures.profile("open", Set.of("*"), Set.of(), 1_000);
            PolicyDecision decision = enforcer.authorize(open, "launch_rocket");
            assertFalse(decision.allowed());
            assertEquals(PolicyEnforcer.REASON_UNKNOWN_TOOL, reason(decision));
        }

        @Test
        @DisplayName("trader without denials may place orders")
        void traderAllowed() {
            AgentProfile trader = TestFixtures.profile("trader", Set.of("binance_spot_*"), Set.of(), 1_000);
            assertTrue(enforcer.authorize(trader, "binance_spot_market_order").allowed());
        }
    }

    @Test
    @DisplayName("usableTools(): sorted registered tools that pass policy")
    void usableTools() {
        AgentProfile risk = TestFixtures.riskManager(1_000);
        assertEquals(List.of("binance_get_account", "binance_get_ticker"), enforcer.usableTools(risk));

        AgentProfile researcher = TestFixtures.profile("researcher", Set.of("*"),
            Set.of(CapabilityTag.EXECUTE_TRADE, CapabilityTag.READ_ACCOUNT), 1_000);
        assertFalse(enforcer.usableTools(researcher).contains("binance_spot_market_order"));
        assertTrue(enforcer.usableTools(researcher).contains("perplexity_sonar"));
    }
}
