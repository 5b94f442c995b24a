package com.songbook.domain.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.songbook.domain.entity.ContentVersionEntity;
import com.songbook.domain.enums.ContentType;

import java.util.List;

/**
 * 版本表只追加：不要对它调用 update/delete。
 */
public interface ContentVersionMapper extends BaseMapper<ContentVersionEntity> {

    default ContentVersionEntity selectLatest(ContentType type, long contentId) {
        return selectOne(new LambdaQueryWrapper<ContentVersionEntity>()
                .eq(ContentVersionEntity::getContentType, type)
                .eq(ContentVersionEntity::getContentId, contentId)
                .orderByDesc(ContentVersionEntity::getVersion)
                .last("limit 1"));
    }

    /** 新的在前。 */
    default List<ContentVersionEntity> selectHistory(ContentType type, long contentId, int limit) {
        return selectList(new LambdaQueryWrapper<ContentVersionEntity>()
                .eq(ContentVersionEntity::getContentType, type)
                .eq(ContentVersionEntity::getContentId, contentId)
                .orderByDesc(ContentVersionEntity::getVersion)
                .last("limit " + Math.max(1, limit)));
    }

    default ContentVersionEntity selectVersion(ContentType type, long contentId, int version) {
        return selectOne(new LambdaQueryWrapper<ContentVersionEntity>()
                .eq(ContentVersionEntity::getContentType, type)
                .eq(ContentVersionEntity::getContentId, contentId)
                .eq(ContentVersionEntity::getVersion, version)
                .last("limit 1"));
    }
}
