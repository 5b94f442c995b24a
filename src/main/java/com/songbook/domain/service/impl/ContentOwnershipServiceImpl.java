package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.domain.entity.ContentCollaboratorEntity;
import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.entity.OwnedContent;
import com.songbook.domain.enums.ContentType;
import com.songbook.domain.enums.MemberRole;
import com.songbook.domain.enums.OwnerType;
import com.songbook.domain.mapper.ContentCollaboratorMapper;
import com.songbook.domain.mapper.GroupMemberMapper;
import com.songbook.domain.service.CommunityGroupLocator;
import com.songbook.domain.service.ContentOwnershipService;
import com.songbook.domain.service.GroupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContentOwnershipServiceImpl implements ContentOwnershipService {

    private final GroupMemberMapper groupMemberMapper;
    private final ContentCollaboratorMapper collaboratorMapper;
    private final GroupService groupService;
    private final CommunityGroupLocator communityGroupLocator;
    private final Clock clock;

    @Override
    public boolean canEdit(OwnedContent content, Actor actor) {
        if (content == null || actor == null || !actor.isRegistered()) {
            return false;
        }
        long uid = actor.userId();
        if (content.getOwnerType() == OwnerType.GROUP) {
            Long groupId = content.ownerGroupId();
            return groupId != null && groupMemberMapper.selectMember(groupId, uid) != null;
        }
        if (actor.is(content.getCreatedBy())) {
            return true;
        }
        return isCollaborator(content, uid);
    }

    @Override
    public boolean isOwner(OwnedContent content, Long userId) {
        return content != null && userId != null && userId.equals(content.getCreatedBy());
    }

    @Override
    public EditAccess editAccess(OwnedContent content, Actor actor) {
        if (content == null || actor == null || !actor.isAuthenticated()) {
            return new EditAccess(false, false, false, content != null && content.isGroupOwned());
        }
        boolean collaborator = content.getOwnerType() != OwnerType.GROUP && isCollaborator(content, actor.userId());
        return new EditAccess(
                canEdit(content, actor),
                isOwner(content, actor.userId()),
                collaborator,
                content.isGroupOwned()
        );
    }

    @Override
    public void requireEdit(OwnedContent content, Actor actor) {
        actor.requireRegistered();
        if (!canEdit(content, actor)) {
            throw new UnauthorizedException("cannot_edit_content");
        }
    }

    @Override
    public void requirePostAsGroup(Actor actor, long groupId) {
        long uid = actor.requireRegistered();
        groupService.requireGroup(groupId);
        if (communityGroupLocator.isCommunityGroup(groupId)) {
            throw new InvalidStateException("community_requires_transfer");
        }
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null || (me.getRole() != MemberRole.OWNER && me.getRole() != MemberRole.ADMIN)) {
            throw new UnauthorizedException("cannot_post_as_group");
        }
    }

    @Override
    public String resolveOwnerForCreate(Actor actor, OwnerType ownerType, String ownerId) {
        long uid = actor.requireRegistered();
        if (ownerType != OwnerType.GROUP) {
            return String.valueOf(uid);
        }
        long groupId;
        try {
            groupId = Long.parseLong(ownerId == null ? "" : ownerId.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad_owner_id");
        }
        requirePostAsGroup(actor, groupId);
        return String.valueOf(groupId);
    }

    @Override
    public List<ContentCollaboratorEntity> listCollaborators(ContentType type, long contentId) {
        List<ContentCollaboratorEntity> list = collaboratorMapper.selectByContent(type, contentId);
        return list == null ? List.of() : list;
    }

    @Transactional
    @Override
    public ContentCollaboratorEntity addCollaborator(Actor actor, OwnedContent content, long userId) {
        long uid = requireCreator(actor, content);
        if (userId <= 0) {
            throw new IllegalArgumentException("bad_user_id");
        }
        if (userId == uid) {
            throw new InvalidStateException("creator_is_owner");
        }
        if (collaboratorMapper.selectCollaborator(content.contentType(), content.getId(), userId) != null) {
            throw new ConflictException("already_collaborator");
        }
        ContentCollaboratorEntity c = new ContentCollaboratorEntity();
        c.setContentType(content.contentType());
        c.setContentId(content.getId());
        c.setUserId(userId);
        c.setAddedBy(uid);
        c.setAddedAt(LocalDateTime.now(clock));
        try {
            collaboratorMapper.insert(c);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("already_collaborator");
        }
        log.info("collaborator added: contentType={}, contentId={}, userId={}, actorId={}",
                content.contentType(), content.getId(), userId, uid);
        return c;
    }

    @Transactional
    @Override
    public void removeCollaborator(Actor actor, OwnedContent content, long userId) {
        long uid = requireCreator(actor, content);
        if (collaboratorMapper.deleteCollaborator(content.contentType(), content.getId(), userId) == 0) {
            throw new NotFoundException("collaborator_not_found");
        }
        log.info("collaborator removed: contentType={}, contentId={}, userId={}, actorId={}",
                content.contentType(), content.getId(), userId, uid);
    }

    private boolean isCollaborator(OwnedContent content, long userId) {
        if (content.getId() == null) {
            return false;
        }
        return collaboratorMapper.selectCollaborator(content.contentType(), content.getId(), userId) != null;
    }

    private long requireCreator(Actor actor, OwnedContent content) {
        long uid = actor.requireRegistered();
        if (!isOwner(content, uid)) {
            throw new UnauthorizedException("creator_required");
        }
        return uid;
    }
}
