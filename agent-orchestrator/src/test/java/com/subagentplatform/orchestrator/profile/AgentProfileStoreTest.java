package com.subagentplatform.orchestrator.profile;

import com.subagentplatform.common.exception.ProfileConfigurationException;
import com.subagentplatform.common.exception.UnknownAgentException;
import com.subagentplatform.common.model.AgentProfile;
import com.subagentplatform.common.model.CapabilityTag;
import com.subagentplatform.orchestrator.config.SubagentProperties.ProfileDefinition;
import com.subagentplatform.orchestrator.registry.ToolRegistry;
import com.subagentplatform.orchestrator.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AgentProfileStoreTest {

    private final ToolRegistry registry = TestFixtures.registry();

    @Nested
    @DisplayName("load-time validation")
    class Validation {

        @Test
        @DisplayName("valid profiles load and are retrievable by name")
        void loads() {
            AgentProfileStore store = new AgentProfileStore(List.of(
                TestFixtures.analyst("news-analyst", 1_000),
                TestFixtures.riskManager(1_000)), registry);
            assertEquals(Set.of("news-analyst", "risk-manager"), store.profileNames());
            assertEquals("risk-manager", store.getProfile("risk-manager").name());
        }

        @Test
        @DisplayName("patterns reaching only denied tools → zero usable tools, rejected")
        void noUsableTools() {
            AgentProfile onlyOrders = TestFixtures.profile("orders-only", Set.of("binance_spot_*"),
                Set.of(CapabilityTag.EXECUTE_TRADE), 1_000);
            ProfileConfigurationException e = assertThrows(ProfileConfigurationException.class,
                () -> new AgentProfileStore(List.of(onlyOrders), registry));
            assertTrue(e.getMessage().contains("orders-only"));
        }

        @Test
        @DisplayName("patterns matching no registered tool → rejected")
        void patternsMatchNothing() {
            AgentProfile ghost = TestFixtures.profile("ghost", Set.of("kraken_*"), Set.of(), 1_000);
            assertThrows(ProfileConfigurationException.class, () -> new AgentProfileStore(List.of(ghost), registry));
        }

        @Test
        @DisplayName("empty allow-list → rejected")
        void emptyAllowList() {
            AgentProfile empty = TestFixtures.profile("empty", Set.of(), Set.of(), 1_000);
            assertThrows(ProfileConfigurationException.class, () -> new AgentProfileStore(List.of(empty), registry));
        }

        @Test
        @DisplayName("denied capability unknown to the registry → rejected")
        void deniedCapabilityUnknownToRegistry() {
            AgentProfile compute = TestFixtures.profile("data-analyst", Set.of("polygon_*"),
                Set.of(CapabilityTag.COMPUTE), 1_000);
            assertThrows(ProfileConfigurationException.class, () -> new AgentProfileStore(List.of(compute), registry));
        }

        @Test
        @DisplayName("non-positive budgets → rejected")
        void nonPositiveBudgets() {
            AgentProfile noTime = TestFixtures.analyst("slow", 0);
            assertThrows(ProfileConfigurationException.class, () -> new AgentProfileStore(List.of(noTime), registry));

            AgentProfile noTokens = new AgentProfile("tiny", "", "", Set.of("polygon_*"), Set.of(), 1_000, 0, Set.of(), null);
            assertThrows(ProfileConfigurationException.class, () -> new AgentProfileStore(List.of(noTokens), registry));
        }

        @Test
        @DisplayName("duplicate names → rejected")
        void duplicates() {
            assertThrows(ProfileConfigurationException.class, () -> new AgentProfileStore(List.of(
                TestFixtures.analyst("news-analyst", 1_000),
                TestFixtures.analyst("news-analyst", 2_000)), registry));
        }
    }

    @Nested
    @DisplayName("fromDefinitions()")
    class Definitions {

        @Test
        @DisplayName("labels are parsed and defaults applied")
        void parsesLabels() {
            ProfileDefinition def = new ProfileDefinition();
            def.setName("risk-manager");
            def.setAllowedTools(List.of("binance_*"));
            def.setDeniedCapabilities(List.of("execute-trade"));
            def.setOutputSchema(List.of("verdict"));

            AgentProfile profile = AgentProfileStore.fromDefinitions(List.of(def), registry).getProfile("risk-manager");
            assertEquals(Set.of(CapabilityTag.EXECUTE_TRADE), profile.deniedCapabilities());
            assertEquals(60_000L, profile.maxDurationMs());
            assertTrue(profile.outputSchema().containsAll(Set.of("verdict", "sentiment", "confidence", "summary")));
        }

        @Test
        @DisplayName("unknown denied capability label → rejected")
        void unknownLabel() {
            ProfileDefinition def = new ProfileDefinition();
            def.setName("x");
            def.setAllowedTools(List.of("polygon_*"));
            def.setDeniedCapabilities(List.of("time-travel"));
            assertThrows(ProfileConfigurationException.class,
                () -> AgentProfileStore.fromDefinitions(List.of(def), registry));
        }
    }

    @Test
    @DisplayName("getProfile() for an unregistered name → UnknownAgentException")
    void unknownAgent() {
        AgentProfileStore store = new AgentProfileStore(List.of(TestFixtures.riskManager(1_000)), registry);
        assertThrows(UnknownAgentException.class, () -> store.getProfile("oracle"));
        assertThrows(UnknownAgentException.class, () -> store.getProfile(null));
    }

    @Test
    @DisplayName("empty registry with no profiles is a valid, empty store")
    void emptyStore() {
        AgentProfileStore store = new AgentProfileStore(List.of(), ToolRegistry.fromDefinitions(Map.of()));
        assertTrue(store.profileNames().isEmpty());
    }
}
