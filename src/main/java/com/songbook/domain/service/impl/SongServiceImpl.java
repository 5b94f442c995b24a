package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.common.util.Slugs;
import com.songbook.domain.dto.SongSnapshot;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.OwnerType;
import com.songbook.domain.mapper.SongMapper;
import com.songbook.domain.service.CommunityGroupLocator;
import com.songbook.domain.service.ContentOwnershipService;
import com.songbook.domain.service.ContentVersionService;
import com.songbook.domain.service.SongService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class SongServiceImpl implements SongService {

    static final String TRANSFER_DESCRIPTION = "Original version (before community transfer)";

    private final SongMapper songMapper;
    private final ContentOwnershipService ownershipService;
    private final ContentVersionService versionService;
    private final CommunityGroupLocator communityGroupLocator;
    private final Clock clock;

    @Override
    public SongEntity requireSong(long songId) {
        if (songId <= 0) {
            throw new IllegalArgumentException("bad_song_id");
        }
        SongEntity s = songMapper.selectById(songId);
        if (s == null) {
            throw new NotFoundException("song_not_found");
        }
        return s;
    }

    @Override
    public SongEntity getBySlug(String slug) {
        SongEntity s = songMapper.selectBySlug(slug == null ? null : slug.trim());
        if (s == null) {
            throw new NotFoundException("song_not_found");
        }
        return s;
    }

    @Transactional
    @Override
    public SongEntity create(Actor actor, SongSnapshot fields, String slug, OwnerType ownerType, String ownerId) {
        long uid = actor.requireRegistered();
        if (fields == null || fields.title() == null || fields.title().isBlank()) {
            throw new IllegalArgumentException("missing_title");
        }
        String resolvedOwnerId = ownershipService.resolveOwnerForCreate(actor, ownerType, ownerId);

        SongEntity s = new SongEntity();
        fields.applyTo(s);
        s.setTitle(fields.title().trim());
        s.setSlug(resolveSlug(slug, fields.title()));
        s.setCreatedBy(uid);
        s.setOwnerType(ownerType == OwnerType.GROUP ? OwnerType.GROUP : OwnerType.USER);
        s.setOwnerId(resolvedOwnerId);
        songMapper.insert(s);
        log.info("song created: songId={}, slug={}, ownerType={}, ownerId={}, actorId={}",
                s.getId(), s.getSlug(), s.getOwnerType(), s.getOwnerId(), uid);
        return s;
    }

    @Transactional
    @Override
    public SongEntity update(Actor actor, long songId, SongSnapshot patch) {
        SongEntity s = requireSong(songId);
        ownershipService.requireEdit(s, actor);
        if (patch != null && patch.title() != null && patch.title().isBlank()) {
            throw new IllegalArgumentException("missing_title");
        }

        SongSnapshot after = SongSnapshot.of(s).merge(patch);
        versionService.recordIfChanged(s, after, actor.userId());

        after.applyTo(s);
        s.setUpdatedAt(LocalDateTime.now(clock));
        songMapper.updateById(s);
        log.info("song updated: songId={}, actorId={}", songId, actor.userId());
        return s;
    }

    @Transactional
    @Override
    public SongEntity transferToCommunity(Actor actor, long songId) {
        long uid = actor.requireUserId();
        SongEntity s = requireSong(songId);
        if (!ownershipService.isOwner(s, uid)) {
            throw new UnauthorizedException("creator_required");
        }
        Long communityId = communityGroupLocator.groupId();
        if (communityId == null) {
            throw new NotFoundException("system_group_not_found");
        }
        if (communityGroupLocator.isCommunityOwned(s)) {
            throw new InvalidStateException("already_community_owned");
        }

        versionService.recordVersion(s, uid, TRANSFER_DESCRIPTION);
        s.setOwnerType(OwnerType.GROUP);
        s.setOwnerId(String.valueOf(communityId));
        s.setUpdatedAt(LocalDateTime.now(clock));
        songMapper.updateById(s);
        log.info("song transferred to community: songId={}, groupId={}, actorId={}", songId, communityId, uid);
        return s;
    }

    @Transactional
    @Override
    public SongEntity reclaimFromCommunity(Actor actor, long songId) {
        long uid = actor.requireUserId();
        SongEntity s = requireSong(songId);
        if (!ownershipService.isOwner(s, uid)) {
            throw new UnauthorizedException("creator_required");
        }
        if (!communityGroupLocator.isCommunityOwned(s)) {
            throw new InvalidStateException("not_community_owned");
        }

        s.setOwnerType(OwnerType.USER);
        s.setOwnerId(String.valueOf(uid));
        s.setUpdatedAt(LocalDateTime.now(clock));
        songMapper.updateById(s);
        log.info("song reclaimed from community: songId={}, actorId={}", songId, uid);
        return s;
    }

    @Override
    public ContentOwnershipService.EditAccess editAccess(Actor actor, long songId) {
        return ownershipService.editAccess(requireSong(songId), actor);
    }

    private String resolveSlug(String slug, String title) {
        if (slug != null && !slug.isBlank()) {
            String s = Slugs.slugify(slug, "song");
            if (songMapper.existsBySlug(s)) {
                throw new ConflictException("slug_taken");
            }
            return s;
        }
        return Slugs.unique(title, "song", songMapper::existsBySlug);
    }
}
