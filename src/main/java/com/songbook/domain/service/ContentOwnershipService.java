package com.songbook.domain.service;

import com.songbook.auth.Actor;
import com.songbook.domain.entity.ContentCollaboratorEntity;
import com.songbook.domain.entity.OwnedContent;
import com.songbook.domain.enums.ContentType;
import com.songbook.domain.enums.OwnerType;

import java.util.List;

/**
 * 内容编辑权：个人内容看创建者和协作者，群内容看是否为该群成员（任何角色都行）。
 * 未登录和匿名会话一律没有编辑权。
 */
public interface ContentOwnershipService {

    boolean canEdit(OwnedContent content, Actor actor);

    /** 只看创建者字段，用于展示“我的”之类的界面标记。 */
    boolean isOwner(OwnedContent content, Long userId);

    EditAccess editAccess(OwnedContent content, Actor actor);

    /** 没有编辑权时抛 UnauthorizedException。 */
    void requireEdit(OwnedContent content, Actor actor);

    /**
     * 以群的名义发布内容：必须是该群群主或管理员，且不能直接发到社区群（社区内容只能转入）。
     */
    void requirePostAsGroup(Actor actor, long groupId);

    /** 解析创建请求里的归属，返回 ownerId（群 id 字符串或创建者 id 字符串）。 */
    String resolveOwnerForCreate(Actor actor, OwnerType ownerType, String ownerId);

    List<ContentCollaboratorEntity> listCollaborators(ContentType type, long contentId);

    ContentCollaboratorEntity addCollaborator(Actor actor, OwnedContent content, long userId);

    void removeCollaborator(Actor actor, OwnedContent content, long userId);

    record EditAccess(boolean canEdit, boolean isOwner, boolean isCollaborator, boolean groupOwned) {
    }
}
