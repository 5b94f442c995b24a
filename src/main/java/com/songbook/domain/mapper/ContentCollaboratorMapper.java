package com.songbook.domain.mapper;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.songbook.domain.entity.ContentCollaboratorEntity;
import com.songbook.domain.enums.ContentType;

import java.util.List;

public interface ContentCollaboratorMapper extends BaseMapper<ContentCollaboratorEntity> {

    default ContentCollaboratorEntity selectCollaborator(ContentType type, long contentId, long userId) {
        return selectOne(new LambdaQueryWrapper<ContentCollaboratorEntity>()
                .eq(ContentCollaboratorEntity::getContentType, type)
                .eq(ContentCollaboratorEntity::getContentId, contentId)
                .eq(ContentCollaboratorEntity::getUserId, userId)
                .last("limit 1"));
    }

    default List<ContentCollaboratorEntity> selectByContent(ContentType type, long contentId) {
        return selectList(new LambdaQueryWrapper<ContentCollaboratorEntity>()
                .eq(ContentCollaboratorEntity::getContentType, type)
                .eq(ContentCollaboratorEntity::getContentId, contentId)
                .orderByAsc(ContentCollaboratorEntity::getAddedAt)
                .orderByAsc(ContentCollaboratorEntity::getId));
    }

    default int deleteCollaborator(ContentType type, long contentId, long userId) {
        return delete(new LambdaQueryWrapper<ContentCollaboratorEntity>()
                .eq(ContentCollaboratorEntity::getContentType, type)
                .eq(ContentCollaboratorEntity::getContentId, contentId)
                .eq(ContentCollaboratorEntity::getUserId, userId));
    }
}
