package com.songbook.domain.service;

import com.songbook.auth.Actor;
import com.songbook.domain.dto.SongSnapshot;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.OwnerType;

public interface SongService {

    SongEntity requireSong(long songId);

    SongEntity getBySlug(String slug);

    /**
     * @param slug      为空时由标题生成；显式给出且已被占用时抛 ConflictException
     * @param ownerType GROUP 时 ownerId 为群 id，调用方须是该群群主或管理员
     */
    SongEntity create(Actor actor, SongSnapshot fields, String slug, OwnerType ownerType, String ownerId);

    /** patch 中为 null 的字段保持不变。社区内容会先记录编辑前的版本。 */
    SongEntity update(Actor actor, long songId, SongSnapshot patch);

    SongEntity transferToCommunity(Actor actor, long songId);

    SongEntity reclaimFromCommunity(Actor actor, long songId);

    ContentOwnershipService.EditAccess editAccess(Actor actor, long songId);
}
