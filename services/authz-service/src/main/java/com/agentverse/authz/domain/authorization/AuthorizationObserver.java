package com.agentverse.authz.domain.authorization;

import com.agentverse.authz.domain.cache.CheckKind;
import com.agentverse.authz.domain.policy.Action;

import java.time.Duration;

/**
 * Receives decision, cache and mutation events for metrics. Implementations must not throw.
 */
public interface AuthorizationObserver {

    AuthorizationObserver NOOP = new AuthorizationObserver() {
        @Override
        public void decision(Action action, Decision decision, Duration elapsed) {
        }

        @Override
        public void cacheLookup(CheckKind kind, boolean hit) {
        }

        @Override
        public void mutation(String operation, String outcome) {
        }
    };

    void decision(Action action, Decision decision, Duration elapsed);

    void cacheLookup(CheckKind kind, boolean hit);

    void mutation(String operation, String outcome);
}
