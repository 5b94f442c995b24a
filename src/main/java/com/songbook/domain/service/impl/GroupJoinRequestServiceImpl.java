package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.entity.GroupJoinRequestEntity;
import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.enums.GroupJoinRequestStatus;
import com.songbook.domain.enums.JoinPolicy;
import com.songbook.domain.enums.MemberRole;
import com.songbook.domain.mapper.GroupJoinRequestMapper;
import com.songbook.domain.mapper.GroupMemberMapper;
import com.songbook.domain.service.GroupJoinRequestService;
import com.songbook.domain.service.GroupPermissionResolver;
import com.songbook.domain.service.GroupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GroupJoinRequestServiceImpl implements GroupJoinRequestService {

    private final GroupService groupService;
    private final GroupMemberMapper groupMemberMapper;
    private final GroupJoinRequestMapper groupJoinRequestMapper;
    private final GroupPermissionResolver permissionResolver;
    private final Clock clock;

    @Transactional
    @Override
    public JoinResult requestJoin(Actor actor, long groupId) {
        long uid = actor.requireRegistered();
        GroupEntity g = groupService.requireGroup(groupId);
        checkCanRequest(groupId, uid);

        if (g.getJoinPolicy() == JoinPolicy.OPEN) {
            if (!insertMember(groupId, uid, null, LocalDateTime.now(clock))) {
                throw new ConflictException("already_member");
            }
            log.info("joined open group: groupId={}, userId={}", groupId, uid);
            return new JoinResult(true, null);
        }
        GroupJoinRequestEntity r = insertRequest(groupId, uid);
        return new JoinResult(false, r.getId());
    }

    @Transactional
    @Override
    public GroupJoinRequestEntity createRequest(Actor actor, long groupId) {
        long uid = actor.requireRegistered();
        GroupEntity g = groupService.requireGroup(groupId);
        if (g.getJoinPolicy() == JoinPolicy.OPEN) {
            throw new InvalidStateException("group_is_open");
        }
        checkCanRequest(groupId, uid);
        return insertRequest(groupId, uid);
    }

    @Transactional
    @Override
    public void cancelRequest(Actor actor, long groupId) {
        long uid = actor.requireUserId();
        GroupJoinRequestEntity r = groupJoinRequestMapper.selectPending(groupId, uid);
        if (r == null) {
            throw new NotFoundException("no_pending_request");
        }
        groupJoinRequestMapper.deleteById(r.getId());
        log.info("join request withdrawn: groupId={}, userId={}, requestId={}", groupId, uid, r.getId());
    }

    @Transactional
    @Override
    public GroupJoinRequestEntity approve(Actor actor, long requestId) {
        return decide(actor, requestId, GroupJoinRequestStatus.APPROVED);
    }

    @Transactional
    @Override
    public GroupJoinRequestEntity reject(Actor actor, long requestId) {
        return decide(actor, requestId, GroupJoinRequestStatus.REJECTED);
    }

    @Transactional
    @Override
    public GroupJoinRequestEntity decide(Actor actor, long requestId, String action) {
        String a = action == null ? "" : action.trim().toLowerCase();
        return switch (a) {
            case "approve" -> decide(actor, requestId, GroupJoinRequestStatus.APPROVED);
            case "reject" -> decide(actor, requestId, GroupJoinRequestStatus.REJECTED);
            default -> throw new IllegalArgumentException("bad_action");
        };
    }

    @Override
    public List<GroupJoinRequestEntity> listPending(Actor actor, long groupId) {
        if (actor == null || !actor.isAuthenticated()) {
            return List.of();
        }
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, actor.userId());
        if (me == null || !permissionResolver.resolve(me.getRole()).canApproveRequests()) {
            return List.of();
        }
        List<GroupJoinRequestEntity> list = groupJoinRequestMapper.selectPendingByGroup(groupId);
        return list == null ? List.of() : list;
    }

    @Override
    public GroupJoinRequestEntity myPendingRequest(Actor actor, long groupId) {
        if (actor == null || !actor.isAuthenticated()) {
            return null;
        }
        return groupJoinRequestMapper.selectPending(groupId, actor.userId());
    }

    private GroupJoinRequestEntity decide(Actor actor, long requestId, GroupJoinRequestStatus to) {
        long uid = actor.requireUserId();
        if (requestId <= 0) {
            throw new IllegalArgumentException("bad_request_id");
        }
        GroupJoinRequestEntity r = groupJoinRequestMapper.selectById(requestId);
        if (r == null) {
            throw new NotFoundException("request_not_found");
        }
        GroupMemberEntity me = groupMemberMapper.selectMember(r.getGroupId(), uid);
        if (me == null || !permissionResolver.resolve(me.getRole()).canApproveRequests()) {
            throw new UnauthorizedException("cannot_approve_requests");
        }
        if (r.getStatus() != GroupJoinRequestStatus.PENDING) {
            throw new InvalidStateException("request_not_pending");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        // 条件更新：并发的第二次审批在这里落空
        if (groupJoinRequestMapper.transition(requestId, to, uid, now) != 1) {
            throw new InvalidStateException("request_not_pending");
        }
        if (to == GroupJoinRequestStatus.APPROVED
                && groupMemberMapper.selectMember(r.getGroupId(), r.getUserId()) == null
                && !insertMember(r.getGroupId(), r.getUserId(), uid, now)) {
            log.debug("approved user joined concurrently: groupId={}, userId={}", r.getGroupId(), r.getUserId());
        }

        r.setStatus(to);
        r.setResolvedBy(uid);
        r.setResolvedAt(now);
        log.info("join request decided: requestId={}, groupId={}, userId={}, status={}, actorId={}",
                requestId, r.getGroupId(), r.getUserId(), to, uid);
        return r;
    }

    private void checkCanRequest(long groupId, long uid) {
        if (groupMemberMapper.selectMember(groupId, uid) != null) {
            throw new ConflictException("already_member");
        }
        if (groupJoinRequestMapper.selectPending(groupId, uid) != null) {
            throw new ConflictException("request_already_pending");
        }
    }

    private GroupJoinRequestEntity insertRequest(long groupId, long uid) {
        GroupJoinRequestEntity r = new GroupJoinRequestEntity();
        r.setGroupId(groupId);
        r.setUserId(uid);
        r.setStatus(GroupJoinRequestStatus.PENDING);
        r.setRequestedAt(LocalDateTime.now(clock));
        groupJoinRequestMapper.insert(r);
        log.info("join request created: groupId={}, userId={}, requestId={}", groupId, uid, r.getId());
        return r;
    }

    /**
     * 插入普通成员；唯一键冲突（并发加入）时返回 false。
     */
    private boolean insertMember(long groupId, long userId, Long invitedBy, LocalDateTime now) {
        GroupMemberEntity m = new GroupMemberEntity();
        m.setGroupId(groupId);
        m.setUserId(userId);
        m.setRole(MemberRole.MEMBER);
        m.setJoinedAt(now);
        m.setInvitedBy(invitedBy);
        m.setRevision(0);
        try {
            groupMemberMapper.insert(m);
        } catch (DuplicateKeyException e) {
            return false;
        }
        return true;
    }
}
