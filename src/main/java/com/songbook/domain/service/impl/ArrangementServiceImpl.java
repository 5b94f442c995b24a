package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.common.util.Slugs;
import com.songbook.domain.dto.ArrangementSnapshot;
import com.songbook.domain.entity.ArrangementEntity;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.OwnerType;
import com.songbook.domain.mapper.ArrangementMapper;
import com.songbook.domain.service.ArrangementService;
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
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ArrangementServiceImpl implements ArrangementService {

    private final ArrangementMapper arrangementMapper;
    private final SongService songService;
    private final ContentOwnershipService ownershipService;
    private final ContentVersionService versionService;
    private final CommunityGroupLocator communityGroupLocator;
    private final Clock clock;

    @Override
    public ArrangementEntity requireArrangement(long arrangementId) {
        if (arrangementId <= 0) {
            throw new IllegalArgumentException("bad_arrangement_id");
        }
        ArrangementEntity a = arrangementMapper.selectById(arrangementId);
        if (a == null) {
            throw new NotFoundException("arrangement_not_found");
        }
        return a;
    }

    @Override
    public ArrangementEntity getBySlug(String slug) {
        ArrangementEntity a = arrangementMapper.selectBySlug(slug == null ? null : slug.trim());
        if (a == null) {
            throw new NotFoundException("arrangement_not_found");
        }
        return a;
    }

    @Override
    public List<ArrangementEntity> listBySong(long songId) {
        songService.requireSong(songId);
        List<ArrangementEntity> list = arrangementMapper.selectBySong(songId);
        return list == null ? List.of() : list;
    }

    @Transactional
    @Override
    public ArrangementEntity create(Actor actor, long songId, ArrangementSnapshot fields, String slug,
                                    OwnerType ownerType, String ownerId) {
        long uid = actor.requireRegistered();
        if (fields == null || fields.name() == null || fields.name().isBlank()) {
            throw new IllegalArgumentException("missing_name");
        }
        SongEntity song = songService.requireSong(songId);
        String resolvedOwnerId = ownershipService.resolveOwnerForCreate(actor, ownerType, ownerId);

        ArrangementEntity a = new ArrangementEntity();
        fields.applyTo(a);
        a.setName(fields.name().trim());
        a.setSongId(song.getId());
        a.setSlug(resolveSlug(slug, song.getTitle() + " " + fields.name()));
        a.setCreatedBy(uid);
        a.setOwnerType(ownerType == OwnerType.GROUP ? OwnerType.GROUP : OwnerType.USER);
        a.setOwnerId(resolvedOwnerId);
        a.setRating(0D);
        a.setFavorites(0);
        arrangementMapper.insert(a);
        log.info("arrangement created: arrangementId={}, songId={}, ownerType={}, ownerId={}, actorId={}",
                a.getId(), songId, a.getOwnerType(), a.getOwnerId(), uid);
        return a;
    }

    @Transactional
    @Override
    public ArrangementEntity update(Actor actor, long arrangementId, ArrangementSnapshot patch) {
        ArrangementEntity a = requireArrangement(arrangementId);
        ownershipService.requireEdit(a, actor);
        if (patch != null && patch.name() != null && patch.name().isBlank()) {
            throw new IllegalArgumentException("missing_name");
        }

        ArrangementSnapshot after = ArrangementSnapshot.of(a).merge(patch);
        versionService.recordIfChanged(a, after, actor.userId());

        after.applyTo(a);
        a.setUpdatedAt(LocalDateTime.now(clock));
        arrangementMapper.updateById(a);
        log.info("arrangement updated: arrangementId={}, actorId={}", arrangementId, actor.userId());
        return a;
    }

    @Transactional
    @Override
    public ArrangementEntity transferToCommunity(Actor actor, long arrangementId) {
        long uid = actor.requireUserId();
        ArrangementEntity a = requireArrangement(arrangementId);
        if (!ownershipService.isOwner(a, uid)) {
            throw new UnauthorizedException("creator_required");
        }
        Long communityId = communityGroupLocator.groupId();
        if (communityId == null) {
            throw new NotFoundException("system_group_not_found");
        }
        if (communityGroupLocator.isCommunityOwned(a)) {
            throw new InvalidStateException("already_community_owned");
        }

        versionService.recordVersion(a, uid, SongServiceImpl.TRANSFER_DESCRIPTION);
        a.setOwnerType(OwnerType.GROUP);
        a.setOwnerId(String.valueOf(communityId));
        a.setUpdatedAt(LocalDateTime.now(clock));
        arrangementMapper.updateById(a);
        log.info("arrangement transferred to community: arrangementId={}, groupId={}, actorId={}",
                arrangementId, communityId, uid);
        return a;
    }

    @Transactional
    @Override
    public ArrangementEntity reclaimFromCommunity(Actor actor, long arrangementId) {
        long uid = actor.requireUserId();
        ArrangementEntity a = requireArrangement(arrangementId);
        if (!ownershipService.isOwner(a, uid)) {
            throw new UnauthorizedException("creator_required");
        }
        if (!communityGroupLocator.isCommunityOwned(a)) {
            throw new InvalidStateException("not_community_owned");
        }

        a.setOwnerType(OwnerType.USER);
        a.setOwnerId(String.valueOf(uid));
        a.setUpdatedAt(LocalDateTime.now(clock));
        arrangementMapper.updateById(a);
        log.info("arrangement reclaimed from community: arrangementId={}, actorId={}", arrangementId, uid);
        return a;
    }

    @Override
    public ContentOwnershipService.EditAccess editAccess(Actor actor, long arrangementId) {
        return ownershipService.editAccess(requireArrangement(arrangementId), actor);
    }

    private String resolveSlug(String slug, String base) {
        if (slug != null && !slug.isBlank()) {
            String s = Slugs.slugify(slug, "arrangement");
            if (arrangementMapper.existsBySlug(s)) {
                throw new ConflictException("slug_taken");
            }
            return s;
        }
        return Slugs.unique(base, "arrangement", arrangementMapper::existsBySlug);
    }
}
