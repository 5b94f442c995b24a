package com.songbook.domain.service;

/**
 * 某个操作者在群内（可选地针对某个目标成员）的能力集合。
 */
public record GroupPermissions(
        boolean canManage,
        boolean canPromote,
        boolean canDemote,
        boolean canRemove,
        boolean canApproveRequests,
        boolean canEditSettings,
        boolean canDeleteGroup,
        boolean canTransferOwnership
) {

    public static final GroupPermissions NONE =
            new GroupPermissions(false, false, false, false, false, false, false, false);
}
