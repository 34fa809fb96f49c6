package com.agentverse.authz.infrastructure.metrics;

import com.agentverse.authz.domain.authorization.AuthorizationObserver;
import com.agentverse.authz.domain.authorization.Decision;
import com.agentverse.authz.domain.cache.CheckKind;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.observability.MetricFactory;
import java.time.Duration;
import java.util.Locale;

/**
 * Publishes authorization events as Micrometer meters:
 *
 * <ul>
 *   <li>{@code authz.decisions} counter, tagged by action and outcome
 *   <li>{@code authz.decision.duration} timer, tagged by action
 *   <li>{@code authz.cache.lookups} counter, tagged by check kind and hit/miss
 *   <li>{@code authz.mutations} counter, tagged by operation and outcome
 * </ul>
 */
public class MicrometerAuthorizationObserver implements AuthorizationObserver {

    private final MetricFactory metrics;

    public MicrometerAuthorizationObserver(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @Override
    public void decision(Action action, Decision decision, Duration elapsed) {
        String actionTag = action == null ? "unknown" : action.value();
        metrics.counter("authz.decisions", "Authorization decisions",
                        "action", actionTag,
                        "outcome", decision.outcome(),
                        "superadmin", Boolean.toString(decision.superadmin()))
                .increment();
        metrics.timer("authz.decision.duration", "Time to reach an authorization decision",
                        "action", actionTag)
                .record(elapsed);
    }

    @Override
    public void cacheLookup(CheckKind kind, boolean hit) {
        metrics.counter("authz.cache.lookups", "Permission cache lookups",
                        "kind", kind.name().toLowerCase(Locale.ROOT),
                        "result", hit ? "hit" : "miss")
                .increment();
    }

    @Override
    public void mutation(String operation, String outcome) {
        metrics.counter("authz.mutations", "Guarded mutations",
                        "operation", operation,
                        "outcome", outcome)
                .increment();
    }
}
