package com.agentverse.authz.api;

import com.agentverse.authz.config.ServiceProperties;
import com.agentverse.authz.domain.policy.Action;
import com.agentverse.authz.domain.policy.ActionPolicy;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service info endpoint, including the active action policy. Needs no caller identity.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final ActionPolicy policy;

    public ServiceInfoController(ServiceProperties properties, ActionPolicy policy) {
        this.properties = properties;
        this.policy = policy;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, String> table = new LinkedHashMap<>();
        for (Action action : Action.values()) {
            table.put(action.value(), policy.requiredRole(action).map(r -> r.value()).orElse("superadmin"));
        }
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "policy", table,
                "timestamp", Instant.now().toString());
    }
}
