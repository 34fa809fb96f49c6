package com.agentverse.authz.api.dto;

import com.agentverse.authz.domain.model.GroupSummary;

public record GroupSummaryResponse(String id, String name, String description, int memberCount) {

    public static GroupSummaryResponse from(GroupSummary summary) {
        return new GroupSummaryResponse(summary.group().id(), summary.group().name(),
                summary.group().description(), summary.memberCount());
    }
}
