package com.songbook.domain.controller;

import com.songbook.auth.web.AuthContext;
import com.songbook.common.api.Result;
import com.songbook.common.ratelimit.RateLimit;
import com.songbook.common.ratelimit.RateLimitKey;
import com.songbook.domain.entity.GroupJoinRequestEntity;
import com.songbook.domain.service.GroupJoinRequestService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
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
@RequestMapping("/group/join")
public class GroupJoinController {

    private final GroupJoinRequestService groupJoinRequestService;

    public record GroupIdRequest(
            @NotNull(message = "missing_group_id") Long groupId
    ) {
    }

    public record DecideRequest(
            @NotNull(message = "missing_request_id") Long requestId,
            @NotBlank(message = "missing_action") String action
    ) {
    }

    @PostMapping("/request")
    @RateLimit(name = "group_join_request", windowSeconds = 60, max = 10, key = RateLimitKey.USER)
    public Result<GroupJoinRequestService.JoinResult> request(@Valid @RequestBody GroupIdRequest req) {
        return Result.ok(groupJoinRequestService.requestJoin(AuthContext.currentActor(), req.groupId()));
    }

    @PostMapping("/cancel")
    public Result<Void> cancel(@Valid @RequestBody GroupIdRequest req) {
        groupJoinRequestService.cancelRequest(AuthContext.currentActor(), req.groupId());
        return Result.okVoid();
    }

    @GetMapping("/requests")
    public Result<List<GroupJoinRequestEntity>> requests(@RequestParam long groupId) {
        return Result.ok(groupJoinRequestService.listPending(AuthContext.currentActor(), groupId));
    }

    @GetMapping("/mine")
    public Result<GroupJoinRequestEntity> mine(@RequestParam long groupId) {
        return Result.ok(groupJoinRequestService.myPendingRequest(AuthContext.currentActor(), groupId));
    }

    @PostMapping("/decide")
    public Result<GroupJoinRequestEntity> decide(@Valid @RequestBody DecideRequest req) {
        return Result.ok(groupJoinRequestService.decide(AuthContext.currentActor(), req.requestId(), req.action()));
    }
}
