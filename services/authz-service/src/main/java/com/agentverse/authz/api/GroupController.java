package com.agentverse.authz.api;

import com.agentverse.authz.api.dto.CreateGroupRequest;
import com.agentverse.authz.api.dto.GroupResponse;
import com.agentverse.authz.api.dto.UpdateGroupRequest;
import com.agentverse.authz.domain.service.GroupService;
import com.agentverse.security.CallerIdentity;
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
@RequestMapping("/api/v1/groups")
public class GroupController {

    private final GroupService groups;

    public GroupController(GroupService groups) {
        this.groups = groups;
    }

    @GetMapping
    public List<GroupResponse> list(CallerIdentity caller) {
        return groups.listGroups(caller).stream().map(GroupResponse::from).toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public GroupResponse create(CallerIdentity caller, @Valid @RequestBody CreateGroupRequest request) {
        return GroupResponse.from(
                groups.createGroup(caller, request.name(), request.description(), request.initialAdminId()));
    }

    @GetMapping("/{groupId}")
    public GroupResponse get(CallerIdentity caller, @PathVariable String groupId) {
        return GroupResponse.from(groups.getGroup(caller, groupId));
    }

    @PutMapping("/{groupId}")
    public GroupResponse update(
            CallerIdentity caller, @PathVariable String groupId, @Valid @RequestBody UpdateGroupRequest request) {
        return GroupResponse.from(groups.updateGroup(caller, groupId, request.name(), request.description()));
    }

    @DeleteMapping("/{groupId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(CallerIdentity caller, @PathVariable String groupId) {
        groups.deleteGroup(caller, groupId);
    }
}
