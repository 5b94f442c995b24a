package com.songbook.domain.service;

import com.songbook.auth.Actor;
import com.songbook.domain.dto.ArrangementSnapshot;
import com.songbook.domain.entity.ArrangementEntity;
import com.songbook.domain.enums.OwnerType;

import java.util.List;

public interface ArrangementService {

    ArrangementEntity requireArrangement(long arrangementId);

    ArrangementEntity getBySlug(String slug);

    List<ArrangementEntity> listBySong(long songId);

    ArrangementEntity create(Actor actor, long songId, ArrangementSnapshot fields, String slug,
                             OwnerType ownerType, String ownerId);

    ArrangementEntity update(Actor actor, long arrangementId, ArrangementSnapshot patch);

    ArrangementEntity transferToCommunity(Actor actor, long arrangementId);

    ArrangementEntity reclaimFromCommunity(Actor actor, long arrangementId);

    ContentOwnershipService.EditAccess editAccess(Actor actor, long arrangementId);
}
