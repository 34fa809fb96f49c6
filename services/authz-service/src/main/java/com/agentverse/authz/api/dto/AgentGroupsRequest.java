package com.agentverse.authz.api.dto;

import jakarta.validation.constraints.NotNull;
import java.util.List;

public record AgentGroupsRequest(@NotNull List<String> groupIds) {
}
