package com.songbook.domain.service;

import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.enums.MemberRole;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 群权限计算：只看角色和资历，不读库，同样的输入永远得到同样的结果。
 *
 * <ul>
 *   <li>群主：可管理任何非群主成员；群级别的审批/设置/解散/转让全部可用</li>
 *   <li>管理员：可管理普通成员，以及比自己资历浅（promotedAt 更晚）的管理员；可审批入群</li>
 *   <li>普通成员、非成员：什么都不能做</li>
 * </ul>
 *
 * <p>资历相同或任一方缺少 promotedAt 都视为“不更资深”。</p>
 */
@Component
public class GroupPermissionResolver {

    /**
     * 群级别权限（不针对具体成员）。
     */
    public GroupPermissions resolve(MemberRole actorRole) {
        if (actorRole == MemberRole.OWNER) {
            return new GroupPermissions(false, false, false, false, true, true, true, true);
        }
        if (actorRole == MemberRole.ADMIN) {
            return new GroupPermissions(false, false, false, false, true, false, false, false);
        }
        return GroupPermissions.NONE;
    }

    public GroupPermissions resolve(MemberRole actorRole, LocalDateTime actorSeniority,
                                    MemberRole targetRole, LocalDateTime targetSeniority) {
        GroupPermissions base = resolve(actorRole);
        boolean manage = canManage(actorRole, actorSeniority, targetRole, targetSeniority);
        return new GroupPermissions(
                manage,
                manage && targetRole == MemberRole.MEMBER,
                manage && targetRole == MemberRole.ADMIN,
                manage,
                base.canApproveRequests(),
                base.canEditSettings(),
                base.canDeleteGroup(),
                base.canTransferOwnership()
        );
    }

    /**
     * actor 为 null 表示非成员。actor 与 target 是同一行时不给任何管理权限。
     */
    public GroupPermissions resolve(GroupMemberEntity actor, GroupMemberEntity target) {
        if (actor == null) {
            return GroupPermissions.NONE;
        }
        if (target == null) {
            return resolve(actor.getRole());
        }
        if (isSameMember(actor, target)) {
            return resolve(actor.getRole());
        }
        return resolve(actor.getRole(), actor.getPromotedAt(), target.getRole(), target.getPromotedAt());
    }

    public boolean canManage(MemberRole actorRole, LocalDateTime actorSeniority,
                             MemberRole targetRole, LocalDateTime targetSeniority) {
        if (actorRole == null || targetRole == null || targetRole == MemberRole.OWNER) {
            return false;
        }
        if (actorRole == MemberRole.OWNER) {
            return true;
        }
        if (actorRole != MemberRole.ADMIN) {
            return false;
        }
        if (targetRole == MemberRole.MEMBER) {
            return true;
        }
        return isMoreSenior(actorSeniority, targetSeniority);
    }

    public boolean canManage(GroupMemberEntity actor, GroupMemberEntity target) {
        if (actor == null || target == null || isSameMember(actor, target)) {
            return false;
        }
        return canManage(actor.getRole(), actor.getPromotedAt(), target.getRole(), target.getPromotedAt());
    }

    static boolean isMoreSenior(LocalDateTime actorPromotedAt, LocalDateTime targetPromotedAt) {
        return actorPromotedAt != null && targetPromotedAt != null && actorPromotedAt.isBefore(targetPromotedAt);
    }

    private static boolean isSameMember(GroupMemberEntity a, GroupMemberEntity b) {
        if (a.getUserId() != null && a.getUserId().equals(b.getUserId())) {
            return true;
        }
        return a.getId() != null && a.getId().equals(b.getId());
    }
}
