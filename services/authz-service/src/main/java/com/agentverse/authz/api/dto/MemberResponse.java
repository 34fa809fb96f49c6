package com.agentverse.authz.api.dto;

import com.agentverse.authz.domain.model.MemberView;
import com.agentverse.authz.domain.model.Membership;
import java.time.Instant;

public record MemberResponse(String userId, String groupId, String displayName, String email, String role,
                             Instant createdAt) {

    public static MemberResponse from(String groupId, MemberView view) {
        return new MemberResponse(view.subjectId(), groupId, view.displayName(), view.email(),
                view.role().value(), view.createdAt());
    }

    public static MemberResponse from(Membership membership) {
        return new MemberResponse(membership.subjectId(), membership.groupId(), null, null,
                membership.role().value(), membership.createdAt());
    }
}
