package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.domain.dto.ContentSnapshot;
import com.songbook.domain.entity.ArrangementEntity;
import com.songbook.domain.entity.ContentVersionEntity;
import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.entity.OwnedContent;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.ContentType;
import com.songbook.domain.enums.MemberRole;
import com.songbook.domain.mapper.ArrangementMapper;
import com.songbook.domain.mapper.ContentVersionMapper;
import com.songbook.domain.mapper.GroupMemberMapper;
import com.songbook.domain.mapper.SongMapper;
import com.songbook.domain.service.CommunityGroupLocator;
import com.songbook.domain.service.ContentSnapshotCodec;
import com.songbook.domain.service.ContentVersionService;
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
public class ContentVersionServiceImpl implements ContentVersionService {

    private static final int HISTORY_MAX = 500;

    private final ContentVersionMapper versionMapper;
    private final SongMapper songMapper;
    private final ArrangementMapper arrangementMapper;
    private final GroupMemberMapper groupMemberMapper;
    private final CommunityGroupLocator communityGroupLocator;
    private final ContentSnapshotCodec codec;
    private final Clock clock;

    @Transactional
    @Override
    public boolean recordIfChanged(OwnedContent current, ContentSnapshot after, long actorId) {
        if (current == null || current.getId() == null || !communityGroupLocator.isCommunityOwned(current)) {
            return false;
        }
        String before = codec.encode(codec.snapshotOf(current));
        if (after != null && before.equals(codec.encode(after))) {
            return false;
        }
        ContentVersionEntity latest = versionMapper.selectLatest(current.contentType(), current.getId());
        if (latest != null && before.equals(latest.getSnapshot())) {
            return false;
        }
        append(current.contentType(), current.getId(), before, actorId, null);
        return true;
    }

    @Transactional
    @Override
    public ContentVersionEntity recordVersion(OwnedContent content, long actorId, String description) {
        String snapshot = codec.encode(codec.snapshotOf(content));
        return append(content.contentType(), content.getId(), snapshot, actorId, description);
    }

    @Override
    public List<ContentVersionEntity> history(Actor actor, ContentType type, long contentId, Integer limit) {
        if (!canAccessHistory(actor, type, contentId)) {
            return List.of();
        }
        int n = (limit == null || limit <= 0) ? HISTORY_MAX : Math.min(limit, HISTORY_MAX);
        List<ContentVersionEntity> list = versionMapper.selectHistory(type, contentId, n);
        return list == null ? List.of() : list;
    }

    @Override
    public ContentVersionEntity getVersion(Actor actor, ContentType type, long contentId, int version) {
        if (!canAccessHistory(actor, type, contentId)) {
            throw new UnauthorizedException("cannot_access_history");
        }
        ContentVersionEntity v = versionMapper.selectVersion(type, contentId, version);
        if (v == null) {
            throw new NotFoundException("version_not_found");
        }
        return v;
    }

    @Override
    public boolean canAccessHistory(Actor actor, ContentType type, long contentId) {
        if (actor == null || !actor.isAuthenticated() || type == null) {
            return false;
        }
        OwnedContent content = load(type, contentId);
        if (content == null || !communityGroupLocator.isCommunityOwned(content)) {
            return false;
        }
        return isCommunityModerator(actor.userId()) || actor.is(content.getCreatedBy());
    }

    @Transactional
    @Override
    public RollbackResult rollback(Actor actor, ContentType type, long contentId, int version) {
        long uid = actor.requireRegistered();
        OwnedContent content = requireContent(type, contentId);
        if (!communityGroupLocator.isCommunityOwned(content)) {
            throw new InvalidStateException("not_community_content");
        }
        if (!isCommunityModerator(uid) && !actor.is(content.getCreatedBy())) {
            throw new UnauthorizedException("cannot_access_history");
        }
        ContentVersionEntity target = versionMapper.selectVersion(type, contentId, version);
        if (target == null) {
            throw new NotFoundException("version_not_found");
        }

        // 当前状态先入历史（与最新版本相同则不重复记录），再写回目标版本
        String current = codec.encode(codec.snapshotOf(content));
        ContentVersionEntity latest = versionMapper.selectLatest(type, contentId);
        if (latest == null || !current.equals(latest.getSnapshot())) {
            append(type, contentId, current, uid, "Rollback preparation (before rollback to v" + version + ")");
        }

        ContentSnapshot restored = codec.decode(type, target.getSnapshot());
        codec.apply(restored, content);
        persist(content);

        ContentVersionEntity recorded = append(type, contentId, target.getSnapshot(), uid,
                "Rolled back to version " + version);
        log.info("content rolled back: contentType={}, contentId={}, toVersion={}, actorId={}",
                type, contentId, version, uid);
        return new RollbackResult(version, recorded.getVersion());
    }

    private ContentVersionEntity append(ContentType type, Long contentId, String snapshot, long actorId, String description) {
        ContentVersionEntity latest = versionMapper.selectLatest(type, contentId);
        int next = latest == null || latest.getVersion() == null ? 1 : latest.getVersion() + 1;

        ContentVersionEntity v = new ContentVersionEntity();
        v.setContentType(type);
        v.setContentId(contentId);
        v.setVersion(next);
        v.setSnapshot(snapshot);
        v.setChangedBy(actorId);
        v.setChangedAt(LocalDateTime.now(clock));
        v.setChangeDescription(description);
        try {
            versionMapper.insert(v);
        } catch (DuplicateKeyException e) {
            log.debug("content version number taken: contentType={}, contentId={}, version={}", type, contentId, next);
            throw new ConflictException(ConflictException.CONCURRENT_MODIFICATION);
        }
        log.info("content version recorded: contentType={}, contentId={}, version={}, actorId={}",
                type, contentId, next, actorId);
        return v;
    }

    private boolean isCommunityModerator(long userId) {
        Long communityId = communityGroupLocator.groupId();
        if (communityId == null) {
            return false;
        }
        GroupMemberEntity m = groupMemberMapper.selectMember(communityId, userId);
        return m != null && (m.getRole() == MemberRole.OWNER || m.getRole() == MemberRole.ADMIN);
    }

    private OwnedContent load(ContentType type, long contentId) {
        if (contentId <= 0) {
            return null;
        }
        return type == ContentType.SONG ? songMapper.selectById(contentId) : arrangementMapper.selectById(contentId);
    }

    private OwnedContent requireContent(ContentType type, long contentId) {
        if (type == null) {
            throw new IllegalArgumentException("bad_content_type");
        }
        OwnedContent content = load(type, contentId);
        if (content == null) {
            throw new NotFoundException("content_not_found");
        }
        return content;
    }

    private void persist(OwnedContent content) {
        if (content instanceof SongEntity s) {
            s.setUpdatedAt(LocalDateTime.now(clock));
            songMapper.updateById(s);
        } else if (content instanceof ArrangementEntity a) {
            a.setUpdatedAt(LocalDateTime.now(clock));
            arrangementMapper.updateById(a);
        }
    }
}
