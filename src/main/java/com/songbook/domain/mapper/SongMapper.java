package com.songbook.domain.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.songbook.domain.entity.SongEntity;

public interface SongMapper extends BaseMapper<SongEntity> {

    default SongEntity selectBySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            return null;
        }
        return selectOne(new LambdaQueryWrapper<SongEntity>()
                .eq(SongEntity::getSlug, slug)
                .last("limit 1"));
    }

    default boolean existsBySlug(String slug) {
        return selectCount(new LambdaQueryWrapper<SongEntity>().eq(SongEntity::getSlug, slug)) > 0;
    }
}
