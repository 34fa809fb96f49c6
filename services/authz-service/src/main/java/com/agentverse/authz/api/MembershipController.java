package com.agentverse.authz.api;

import com.agentverse.authz.api.dto.MemberRequest;
import com.agentverse.authz.api.dto.MemberResponse;
import com.agentverse.authz.api.dto.RoleRequest;
import com.agentverse.authz.domain.service.MembershipService;
import com.agentverse.security.CallerIdentity;
import com.agentverse.security.GroupRole;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/groups/{groupId}/members")
public class MembershipController {

    private final MembershipService memberships;

    public MembershipController(MembershipService memberships) {
        this.memberships = memberships;
    }

    @GetMapping
    public List<MemberResponse> list(CallerIdentity caller, @PathVariable String groupId) {
        return memberships.listMembers(caller, groupId).stream()
                .map(view -> MemberResponse.from(groupId, view))
                .toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public MemberResponse add(CallerIdentity caller, @PathVariable String groupId,
                              @Valid @RequestBody MemberRequest request) {
        return MemberResponse.from(
                memberships.addMember(caller, groupId, request.userId(), parseRole(request.role())));
    }

    @PutMapping("/{userId}")
    public MemberResponse updateRole(CallerIdentity caller, @PathVariable String groupId,
                                     @PathVariable String userId, @Valid @RequestBody RoleRequest request) {
        return MemberResponse.from(
                memberships.updateMemberRole(caller, groupId, userId, parseRole(request.role())));
    }

    @DeleteMapping("/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void remove(CallerIdentity caller, @PathVariable String groupId, @PathVariable String userId) {
        memberships.removeMember(caller, groupId, userId);
    }

    private static GroupRole parseRole(String role) {
        return GroupRole.fromString(role)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + role));
    }
}
