package com.songbook.domain.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.songbook.domain.entity.GroupEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface GroupMapper extends BaseMapper<GroupEntity> {

    default GroupEntity selectBySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            return null;
        }
        return selectOne(new LambdaQueryWrapper<GroupEntity>()
                .eq(GroupEntity::getSlug, slug)
                .last("limit 1"));
    }

    default GroupEntity selectSystemGroup() {
        return selectOne(new LambdaQueryWrapper<GroupEntity>()
                .eq(GroupEntity::getSystemGroup, true)
                .orderByAsc(GroupEntity::getId)
                .last("limit 1"));
    }

    default boolean existsBySlug(String slug) {
        return selectCount(new LambdaQueryWrapper<GroupEntity>().eq(GroupEntity::getSlug, slug)) > 0;
    }

    @Select("""
            select g.*
            from t_group g
            join t_group_member m on m.group_id = g.id
            where m.user_id = #{userId}
            order by m.role asc, g.id asc
            """)
    List<GroupEntity> selectGroupsForUser(@Param("userId") long userId);
}
