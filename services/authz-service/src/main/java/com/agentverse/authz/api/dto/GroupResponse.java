package com.agentverse.authz.api.dto;

import com.agentverse.authz.domain.model.Group;
import java.time.Instant;

public record GroupResponse(String id, String name, String description, Instant createdAt, Instant updatedAt) {

    public static GroupResponse from(Group group) {
        return new GroupResponse(group.id(), group.name(), group.description(), group.createdAt(), group.updatedAt());
    }
}
