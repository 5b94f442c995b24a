package com.songbook.domain.controller;

import com.songbook.auth.web.AuthContext;
import com.songbook.common.api.Result;
import com.songbook.domain.service.GroupManagementService;
import com.songbook.domain.service.GroupPermissions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
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
@RequestMapping("/group/member")
public class GroupMemberController {

    private final GroupManagementService groupManagementService;

    public record MemberActionRequest(
            @NotNull(message = "missing_group_id") Long groupId,
            @NotNull(message = "missing_user_id") Long userId
    ) {
    }

    public record GroupIdRequest(
            @NotNull(message = "missing_group_id") Long groupId
    ) {
    }

    @GetMapping("/list")
    public Result<List<GroupManagementService.GroupMember>> list(@RequestParam long groupId) {
        return Result.ok(groupManagementService.memberList(groupId));
    }

    @GetMapping("/permissions")
    public Result<GroupPermissions> permissions(@RequestParam long groupId,
                                                @RequestParam(required = false) Long targetUserId) {
        return Result.ok(groupManagementService.permissions(AuthContext.currentActor(), groupId, targetUserId));
    }

    @PostMapping("/promote")
    public Result<Void> promote(@Valid @RequestBody MemberActionRequest req) {
        groupManagementService.promoteToAdmin(AuthContext.currentActor(), req.groupId(), req.userId());
        return Result.okVoid();
    }

    @PostMapping("/demote")
    public Result<Void> demote(@Valid @RequestBody MemberActionRequest req) {
        groupManagementService.demoteAdmin(AuthContext.currentActor(), req.groupId(), req.userId());
        return Result.okVoid();
    }

    @PostMapping("/remove")
    public Result<Void> remove(@Valid @RequestBody MemberActionRequest req) {
        groupManagementService.removeMember(AuthContext.currentActor(), req.groupId(), req.userId());
        return Result.okVoid();
    }

    @PostMapping("/transfer-owner")
    public Result<Void> transferOwner(@Valid @RequestBody MemberActionRequest req) {
        groupManagementService.transferOwnership(AuthContext.currentActor(), req.groupId(), req.userId());
        return Result.okVoid();
    }

    @PostMapping("/leave")
    public Result<GroupManagementService.LeaveResult> leave(@Valid @RequestBody GroupIdRequest req) {
        return Result.ok(groupManagementService.leaveGroup(AuthContext.currentActor(), req.groupId()));
    }
}
