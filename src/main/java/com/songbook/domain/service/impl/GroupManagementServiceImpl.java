package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.domain.cache.GroupBaseCache;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.enums.MemberRole;
import com.songbook.domain.mapper.GroupJoinRequestMapper;
import com.songbook.domain.mapper.GroupMapper;
import com.songbook.domain.mapper.GroupMemberMapper;
import com.songbook.domain.service.CommunityGroupLocator;
import com.songbook.domain.service.GroupManagementService;
import com.songbook.domain.service.GroupPermissionResolver;
import com.songbook.domain.service.GroupPermissions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GroupManagementServiceImpl implements GroupManagementService {

    /** 管理员按 promotedAt 升序（缺失的排最后），再按入群时间、行 id。 */
    static final Comparator<GroupMemberEntity> ADMIN_SENIORITY = Comparator
            .comparing(GroupMemberEntity::getPromotedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GroupMemberEntity::getJoinedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GroupMemberEntity::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    static final Comparator<GroupMemberEntity> MEMBER_TENURE = Comparator
            .comparing(GroupMemberEntity::getJoinedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GroupMemberEntity::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final GroupMapper groupMapper;
    private final GroupMemberMapper groupMemberMapper;
    private final GroupJoinRequestMapper groupJoinRequestMapper;
    private final GroupPermissionResolver permissionResolver;
    private final CommunityGroupLocator communityGroupLocator;
    private final GroupBaseCache groupBaseCache;
    private final Clock clock;

    @Override
    public List<GroupMember> memberList(long groupId) {
        requireGroup(groupId);
        List<GroupMemberEntity> members = groupMemberMapper.selectByGroup(groupId);
        if (members == null || members.isEmpty()) {
            return List.of();
        }
        List<GroupMember> out = new ArrayList<>(members.size());
        for (GroupMemberEntity m : members) {
            if (m == null || m.getUserId() == null) {
                continue;
            }
            out.add(new GroupMember(m.getUserId(), m.getRole(), m.getJoinedAt(), m.getPromotedAt(), m.getInvitedBy()));
        }
        return out;
    }

    @Override
    public GroupPermissions permissions(Actor actor, long groupId, Long targetUserId) {
        if (actor == null || !actor.isAuthenticated()) {
            return GroupPermissions.NONE;
        }
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, actor.userId());
        if (me == null) {
            return GroupPermissions.NONE;
        }
        GroupMemberEntity target = null;
        if (targetUserId != null && targetUserId > 0) {
            target = groupMemberMapper.selectMember(groupId, targetUserId);
            if (target == null) {
                throw new NotFoundException("target_not_member");
            }
        }
        return permissionResolver.resolve(me, target);
    }

    @Transactional
    @Override
    public void promoteToAdmin(Actor actor, long groupId, long targetUserId) {
        long uid = actor.requireUserId();
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null || (me.getRole() != MemberRole.OWNER && me.getRole() != MemberRole.ADMIN)) {
            throw new UnauthorizedException("cannot_promote");
        }
        GroupMemberEntity target = requireTarget(groupId, targetUserId);
        if (target.getRole() != MemberRole.MEMBER) {
            if (uid == targetUserId || permissionResolver.canManage(me, target)) {
                throw new InvalidStateException("already_admin_or_owner");
            }
            throw new UnauthorizedException("insufficient_seniority");
        }
        if (!permissionResolver.resolve(me, target).canPromote()) {
            throw new UnauthorizedException("cannot_promote");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        casRole(target, MemberRole.ADMIN, now, now);
        log.info("member promoted: groupId={}, actorId={}, targetId={}", groupId, uid, targetUserId);
    }

    @Transactional
    @Override
    public void demoteAdmin(Actor actor, long groupId, long targetUserId) {
        long uid = actor.requireUserId();
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null) {
            throw new UnauthorizedException("not_member");
        }
        GroupMemberEntity target = requireTarget(groupId, targetUserId);
        if (target.getRole() != MemberRole.ADMIN) {
            throw new InvalidStateException("not_admin");
        }
        if (!permissionResolver.resolve(me, target).canDemote()) {
            throw new UnauthorizedException("insufficient_seniority");
        }

        casRole(target, MemberRole.MEMBER, null, LocalDateTime.now(clock));
        log.info("admin demoted: groupId={}, actorId={}, targetId={}", groupId, uid, targetUserId);
    }

    @Transactional
    @Override
    public void removeMember(Actor actor, long groupId, long targetUserId) {
        long uid = actor.requireUserId();
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null) {
            throw new UnauthorizedException("not_member");
        }
        GroupMemberEntity target = requireTarget(groupId, targetUserId);
        if (target.getRole() == MemberRole.OWNER) {
            throw new ConflictException("cannot_remove_owner");
        }
        if (!permissionResolver.resolve(me, target).canRemove()) {
            throw new UnauthorizedException("insufficient_seniority");
        }

        casDelete(target);
        log.info("member removed: groupId={}, actorId={}, targetId={}", groupId, uid, targetUserId);
    }

    @Transactional
    @Override
    public void transferOwnership(Actor actor, long groupId, long targetUserId) {
        long uid = actor.requireUserId();
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null || me.getRole() != MemberRole.OWNER) {
            throw new UnauthorizedException("owner_required");
        }
        if (uid == targetUserId) {
            throw new InvalidStateException("already_owner");
        }
        GroupMemberEntity target = requireTarget(groupId, targetUserId);

        // 原群主进入管理员队尾，新群主不带资历
        LocalDateTime now = LocalDateTime.now(clock);
        casRole(me, MemberRole.ADMIN, now, now);
        casRole(target, MemberRole.OWNER, null, now);
        log.info("ownership transferred: groupId={}, fromId={}, toId={}", groupId, uid, targetUserId);
    }

    @Transactional
    @Override
    public LeaveResult leaveGroup(Actor actor, long groupId) {
        long uid = actor.requireUserId();
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null) {
            throw new NotFoundException("not_member");
        }
        if (me.getRole() != MemberRole.OWNER) {
            casDelete(me);
            log.info("member left: groupId={}, userId={}", groupId, uid);
            return new LeaveResult(false, null);
        }

        GroupEntity group = requireGroup(groupId);
        GroupMemberEntity successor = pickSuccessor(groupId, uid);
        if (successor == null) {
            if (communityGroupLocator.isCommunityGroup(group)) {
                throw new InvalidStateException("system_group_requires_owner");
            }
            groupJoinRequestMapper.deleteByGroup(groupId);
            casDelete(me);
            groupMapper.deleteById(groupId);
            groupBaseCache.evict(groupId);
            log.info("sole owner left, group deleted: groupId={}, userId={}", groupId, uid);
            return new LeaveResult(true, null);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        casRole(successor, MemberRole.OWNER, null, now);
        casDelete(me);
        log.info("owner left: groupId={}, userId={}, successorId={}", groupId, uid, successor.getUserId());
        return new LeaveResult(false, successor.getUserId());
    }

    /**
     * 继任者：资历最深的管理员；没有管理员时取入群最早的成员。
     */
    GroupMemberEntity pickSuccessor(long groupId, long leavingUserId) {
        List<GroupMemberEntity> members = groupMemberMapper.selectByGroup(groupId);
        if (members == null || members.isEmpty()) {
            return null;
        }
        List<GroupMemberEntity> others = new ArrayList<>();
        for (GroupMemberEntity m : members) {
            if (m != null && m.getUserId() != null && m.getUserId() != leavingUserId) {
                others.add(m);
            }
        }
        GroupMemberEntity admin = others.stream()
                .filter(m -> m.getRole() == MemberRole.ADMIN)
                .min(ADMIN_SENIORITY)
                .orElse(null);
        if (admin != null) {
            return admin;
        }
        return others.stream().min(MEMBER_TENURE).orElse(null);
    }

    private GroupEntity requireGroup(long groupId) {
        if (groupId <= 0) {
            throw new IllegalArgumentException("bad_group_id");
        }
        GroupEntity g = groupMapper.selectById(groupId);
        if (g == null) {
            throw new NotFoundException("group_not_found");
        }
        return g;
    }

    private GroupMemberEntity requireTarget(long groupId, long targetUserId) {
        if (targetUserId <= 0) {
            throw new IllegalArgumentException("bad_target_user_id");
        }
        GroupMemberEntity target = groupMemberMapper.selectMember(groupId, targetUserId);
        if (target == null) {
            throw new NotFoundException("target_not_member");
        }
        return target;
    }

    private void casRole(GroupMemberEntity m, MemberRole role, LocalDateTime promotedAt, LocalDateTime now) {
        if (groupMemberMapper.updateRole(m, role, promotedAt, now) != 1) {
            log.debug("member role cas lost: memberId={}, revision={}", m.getId(), m.getRevision());
            throw new ConflictException(ConflictException.CONCURRENT_MODIFICATION);
        }
    }

    private void casDelete(GroupMemberEntity m) {
        if (groupMemberMapper.deleteMember(m) != 1) {
            log.debug("member delete cas lost: memberId={}, revision={}", m.getId(), m.getRevision());
            throw new ConflictException(ConflictException.CONCURRENT_MODIFICATION);
        }
    }
}
