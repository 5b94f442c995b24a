package com.songbook.domain.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.songbook.domain.entity.ArrangementEntity;

import java.util.List;

public interface ArrangementMapper extends BaseMapper<ArrangementEntity> {

    default ArrangementEntity selectBySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            return null;
        }
        return selectOne(new LambdaQueryWrapper<ArrangementEntity>()
                .eq(ArrangementEntity::getSlug, slug)
                .last("limit 1"));
    }

    default boolean existsBySlug(String slug) {
        return selectCount(new LambdaQueryWrapper<ArrangementEntity>().eq(ArrangementEntity::getSlug, slug)) > 0;
    }

    default List<ArrangementEntity> selectBySong(long songId) {
        return selectList(new LambdaQueryWrapper<ArrangementEntity>()
                .eq(ArrangementEntity::getSongId, songId)
                .orderByAsc(ArrangementEntity::getId));
    }
}
