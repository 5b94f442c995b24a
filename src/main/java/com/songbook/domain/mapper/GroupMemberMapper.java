package com.songbook.domain.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.enums.MemberRole;

import java.time.LocalDateTime;
import java.util.List;

public interface GroupMemberMapper extends BaseMapper<GroupMemberEntity> {

    default GroupMemberEntity selectMember(long groupId, long userId) {
        return selectOne(new LambdaQueryWrapper<GroupMemberEntity>()
                .eq(GroupMemberEntity::getGroupId, groupId)
                .eq(GroupMemberEntity::getUserId, userId)
                .last("limit 1"));
    }

    /** 群主、管理员、成员依次排列，同角色按入群先后。 */
    default List<GroupMemberEntity> selectByGroup(long groupId) {
        return selectList(new LambdaQueryWrapper<GroupMemberEntity>()
                .eq(GroupMemberEntity::getGroupId, groupId)
                .orderByAsc(GroupMemberEntity::getRole)
                .orderByAsc(GroupMemberEntity::getJoinedAt)
                .orderByAsc(GroupMemberEntity::getId));
    }

    default long countByGroup(long groupId) {
        Long cnt = selectCount(new LambdaQueryWrapper<GroupMemberEntity>()
                .eq(GroupMemberEntity::getGroupId, groupId));
        return cnt == null ? 0 : cnt;
    }

    /**
     * 条件更新角色：只有行版本号未变时才生效，返回 0 表示被并发修改。
     */
    default int updateRole(GroupMemberEntity member, MemberRole role, LocalDateTime promotedAt, LocalDateTime now) {
        int revision = member.getRevision() == null ? 0 : member.getRevision();
        return update(null, new LambdaUpdateWrapper<GroupMemberEntity>()
                .eq(GroupMemberEntity::getId, member.getId())
                .eq(GroupMemberEntity::getRevision, revision)
                .set(GroupMemberEntity::getRole, role)
                .set(GroupMemberEntity::getPromotedAt, promotedAt)
                .set(GroupMemberEntity::getRevision, revision + 1)
                .set(GroupMemberEntity::getUpdatedAt, now));
    }

    /** 条件删除：行版本号不一致时返回 0。 */
    default int deleteMember(GroupMemberEntity member) {
        return delete(new LambdaQueryWrapper<GroupMemberEntity>()
                .eq(GroupMemberEntity::getId, member.getId())
                .eq(GroupMemberEntity::getRevision, member.getRevision() == null ? 0 : member.getRevision()));
    }

    default int deleteByGroup(long groupId) {
        return delete(new LambdaQueryWrapper<GroupMemberEntity>()
                .eq(GroupMemberEntity::getGroupId, groupId));
    }
}
