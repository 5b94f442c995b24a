package com.songbook.domain.controller;

import com.songbook.auth.web.AuthContext;
import com.songbook.common.api.Result;
import com.songbook.common.ratelimit.RateLimit;
import com.songbook.common.ratelimit.RateLimitKey;
import com.songbook.domain.enums.JoinPolicy;
import com.songbook.domain.service.GroupService;
import com.songbook.domain.service.GroupService.GroupProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/group")
public class GroupController {

    private final GroupService groupService;

    public record CreateGroupRequest(
            @NotBlank(message = "missing_name") @Size(max = 100, message = "name_too_long") String name,
            @Size(max = 1000, message = "description_too_long") String description,
            String joinPolicy
    ) {
    }

    public record UpdateGroupRequest(
            @NotNull(message = "missing_group_id") Long groupId,
            @Size(max = 100, message = "name_too_long") String name,
            @Size(max = 1000, message = "description_too_long") String description,
            String joinPolicy
    ) {
    }

    public record GroupIdRequest(
            @NotNull(message = "missing_group_id") Long groupId
    ) {
    }

    @PostMapping("/create")
    @RateLimit(name = "group_create", windowSeconds = 60, max = 3, key = RateLimitKey.USER)
    public Result<GroupProfile> create(@Valid @RequestBody CreateGroupRequest req) {
        return Result.ok(groupService.createGroup(AuthContext.currentActor(), req.name(), req.description(),
                parsePolicy(req.joinPolicy())));
    }

    @PostMapping("/update")
    public Result<GroupProfile> update(@Valid @RequestBody UpdateGroupRequest req) {
        return Result.ok(groupService.updateGroup(AuthContext.currentActor(), req.groupId(), req.name(),
                req.description(), parsePolicy(req.joinPolicy())));
    }

    @PostMapping("/delete")
    public Result<Void> delete(@Valid @RequestBody GroupIdRequest req) {
        groupService.deleteGroup(AuthContext.currentActor(), req.groupId());
        return Result.okVoid();
    }

    @GetMapping("/profile")
    public Result<GroupProfile> profile(@RequestParam long groupId) {
        return Result.ok(groupService.profileById(AuthContext.currentActor(), groupId));
    }

    @GetMapping("/by-slug")
    public Result<GroupProfile> bySlug(@RequestParam String slug) {
        return Result.ok(groupService.profileBySlug(AuthContext.currentActor(), slug));
    }

    @GetMapping("/list")
    public Result<List<GroupProfile>> list() {
        return Result.ok(groupService.listGroups(AuthContext.currentActor()));
    }

    @GetMapping("/mine")
    public Result<List<GroupProfile>> mine() {
        return Result.ok(groupService.myGroups(AuthContext.currentActor()));
    }

    @GetMapping("/system")
    public Result<GroupProfile> system() {
        return Result.ok(groupService.systemGroup(AuthContext.currentActor()));
    }

    private static JoinPolicy parsePolicy(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        JoinPolicy p = JoinPolicy.fromString(raw);
        if (p == null) {
            throw new IllegalArgumentException("bad_join_policy");
        }
        return p;
    }
}
