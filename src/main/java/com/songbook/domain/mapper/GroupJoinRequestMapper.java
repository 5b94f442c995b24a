package com.songbook.domain.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.songbook.domain.entity.GroupJoinRequestEntity;
import com.songbook.domain.enums.GroupJoinRequestStatus;

import java.time.LocalDateTime;
import java.util.List;

public interface GroupJoinRequestMapper extends BaseMapper<GroupJoinRequestEntity> {

    default GroupJoinRequestEntity selectPending(long groupId, long userId) {
        return selectOne(new LambdaQueryWrapper<GroupJoinRequestEntity>()
                .eq(GroupJoinRequestEntity::getGroupId, groupId)
                .eq(GroupJoinRequestEntity::getUserId, userId)
                .eq(GroupJoinRequestEntity::getStatus, GroupJoinRequestStatus.PENDING)
                .orderByDesc(GroupJoinRequestEntity::getId)
                .last("limit 1"));
    }

    default List<GroupJoinRequestEntity> selectPendingByGroup(long groupId) {
        return selectList(new LambdaQueryWrapper<GroupJoinRequestEntity>()
                .eq(GroupJoinRequestEntity::getGroupId, groupId)
                .eq(GroupJoinRequestEntity::getStatus, GroupJoinRequestStatus.PENDING)
                .orderByAsc(GroupJoinRequestEntity::getRequestedAt)
                .orderByAsc(GroupJoinRequestEntity::getId));
    }

    /**
     * PENDING -> APPROVED/REJECTED 的条件迁移；返回 0 表示申请已不是 PENDING（被别人处理过）。
     */
    default int transition(long requestId, GroupJoinRequestStatus to, Long resolvedBy, LocalDateTime resolvedAt) {
        return update(null, new LambdaUpdateWrapper<GroupJoinRequestEntity>()
                .eq(GroupJoinRequestEntity::getId, requestId)
                .eq(GroupJoinRequestEntity::getStatus, GroupJoinRequestStatus.PENDING)
                .set(GroupJoinRequestEntity::getStatus, to)
                .set(GroupJoinRequestEntity::getResolvedBy, resolvedBy)
                .set(GroupJoinRequestEntity::getResolvedAt, resolvedAt)
                .set(GroupJoinRequestEntity::getUpdatedAt, resolvedAt));
    }

    default int deleteByGroup(long groupId) {
        return delete(new LambdaQueryWrapper<GroupJoinRequestEntity>()
                .eq(GroupJoinRequestEntity::getGroupId, groupId));
    }
}
