package com.songbook.domain.service;

import com.songbook.auth.Actor;
import com.songbook.domain.enums.MemberRole;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 群成员治理：升降管理员、移除成员、转让群主、退群（含群主继任）。
 *
 * <p>每个操作都先校验前置条件再写库，并在同一事务里完成；
 * 成员行的并发修改以 {@link com.songbook.common.error.ConflictException} 失败并整体回滚。</p>
 */
public interface GroupManagementService {

    /** 群主、管理员、成员依次排列。 */
    List<GroupMember> memberList(long groupId);

    /**
     * 调用方在群内的能力；targetUserId 为空时只返回群级别权限。
     */
    GroupPermissions permissions(Actor actor, long groupId, Long targetUserId);

    void promoteToAdmin(Actor actor, long groupId, long targetUserId);

    void demoteAdmin(Actor actor, long groupId, long targetUserId);

    void removeMember(Actor actor, long groupId, long targetUserId);

    void transferOwnership(Actor actor, long groupId, long targetUserId);

    LeaveResult leaveGroup(Actor actor, long groupId);

    record GroupMember(
            Long userId,
            MemberRole role,
            LocalDateTime joinedAt,
            LocalDateTime promotedAt,
            Long invitedBy
    ) {
    }

    /**
     * @param groupDeleted    唯一成员（群主）退出导致群被解散
     * @param successorUserId 群主退出时接任的新群主
     */
    record LeaveResult(boolean groupDeleted, Long successorUserId) {
    }
}
