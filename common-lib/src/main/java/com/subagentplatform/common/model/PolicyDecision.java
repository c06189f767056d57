package com.subagentplatform.common.model;

/**
 * Verdict for a single attempted tool call.
 */
public sealed interface PolicyDecision permits PolicyDecision.Allow, PolicyDecision.Deny {

    boolean allowed();

    static PolicyDecision allow() {
        return Allow.INSTANCE;
    }

    static PolicyDecision deny(String reason) {
        return new Deny(reason);
    }

    final class Allow implements PolicyDecision {
        private static final Allow INSTANCE = new Allow();

        private Allow() {}

        @Override
        public boolean allowed() {
            return true;
        }

        @Override
        public String toString() {
            return "Allow";
        }
    }

    record Deny(String reason) implements PolicyDecision {
        @Override
        public boolean allowed() {
            return false;
        }
    }
}
