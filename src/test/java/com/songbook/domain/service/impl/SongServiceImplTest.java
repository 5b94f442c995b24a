package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.ConflictException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.domain.dto.SongSnapshot;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.OwnerType;
import com.songbook.domain.mapper.SongMapper;
import com.songbook.domain.service.CommunityGroupLocator;
import com.songbook.domain.service.ContentOwnershipService;
import com.songbook.domain.service.ContentVersionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SongServiceImplTest {

    private static final long CREATOR = 7L;
    private static final long COMMUNITY = 50L;

    private SongMapper songMapper;
    private ContentOwnershipService ownershipService;
    private ContentVersionService versionService;
    private CommunityGroupLocator locator;
    private SongServiceImpl svc;

    @BeforeEach
    void setUp() {
        songMapper = mock(SongMapper.class);
        ownershipService = mock(ContentOwnershipService.class);
        versionService = mock(ContentVersionService.class);
        locator = mock(CommunityGroupLocator.class);
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        svc = new SongServiceImpl(songMapper, ownershipService, versionService, locator, clock);
    }

    private SongEntity stored(long id, OwnerType ownerType, String ownerId) {
        SongEntity s = new SongEntity();
        s.setId(id);
        s.setTitle("Amazing Grace");
        s.setLyrics("old");
        s.setCreatedBy(CREATOR);
        s.setOwnerType(ownerType);
        s.setOwnerId(ownerId);
        when(songMapper.selectById(id)).thenReturn(s);
        return s;
    }

    @Test
    void update_ShouldRecordVersionBeforePersisting() {
        SongEntity s = stored(1L, OwnerType.GROUP, String.valueOf(COMMUNITY));
        when(versionService.recordIfChanged(any(), any(), anyLong())).thenAnswer(inv -> {
            SongEntity current = inv.getArgument(0);
            SongSnapshot after = inv.getArgument(1);
            assertEquals("old", current.getLyrics());
            assertEquals("new", after.lyrics());
            return true;
        });

        SongEntity updated = svc.update(Actor.user(CREATOR), 1L, new SongSnapshot(null, null, List.of("grace"), null, "new"));

        InOrder inOrder = inOrder(ownershipService, versionService, songMapper);
        inOrder.verify(ownershipService).requireEdit(s, Actor.user(CREATOR));
        inOrder.verify(versionService).recordIfChanged(eq(s), any(), eq(CREATOR));
        inOrder.verify(songMapper).updateById(s);
        assertEquals("new", updated.getLyrics());
        assertEquals("Amazing Grace", updated.getTitle());
        assertEquals(List.of("grace"), updated.getThemes());
        assertNotNull(updated.getUpdatedAt());
    }

    @Test
    void update_ShouldStopWithoutEditRight() {
        SongEntity s = stored(1L, OwnerType.USER, String.valueOf(CREATOR));
        doThrow(new UnauthorizedException("cannot_edit_content")).when(ownershipService).requireEdit(eq(s), any());

        assertThrows(UnauthorizedException.class, () -> svc.update(Actor.user(99L), 1L, new SongSnapshot(null, null, null, null, "x")));
        verifyNoInteractions(versionService);
        verify(songMapper, never()).updateById(any(SongEntity.class));
        assertEquals("old", s.getLyrics());
    }

    @Test
    void update_ShouldRejectBlankTitle() {
        stored(1L, OwnerType.USER, String.valueOf(CREATOR));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> svc.update(Actor.user(CREATOR), 1L, new SongSnapshot(" ", null, null, null, null)));
        assertEquals("missing_title", e.getMessage());
    }

    @Test
    void create_ShouldResolveOwnerAndSlug() {
        when(ownershipService.resolveOwnerForCreate(any(), eq(OwnerType.USER), any())).thenReturn(String.valueOf(CREATOR));
        when(songMapper.existsBySlug("amazing-grace")).thenReturn(true);

        SongEntity s = svc.create(Actor.user(CREATOR),
                new SongSnapshot(" Amazing Grace ", "John Newton", null, null, "verse"), null, OwnerType.USER, null);

        assertEquals("Amazing Grace", s.getTitle());
        assertEquals("amazing-grace-1", s.getSlug());
        assertEquals(OwnerType.USER, s.getOwnerType());
        assertEquals(String.valueOf(CREATOR), s.getOwnerId());
        assertEquals(CREATOR, s.getCreatedBy());
        verify(songMapper).insert(s);
    }

    @Test
    void create_ShouldRejectTakenExplicitSlugAndMissingTitle() {
        when(songMapper.existsBySlug(anyString())).thenReturn(true);

        ConflictException e = assertThrows(ConflictException.class, () -> svc.create(Actor.user(CREATOR),
                new SongSnapshot("Title", null, null, null, null), "Taken Slug", OwnerType.USER, null));
        assertEquals("slug_taken", e.reason());
        assertThrows(IllegalArgumentException.class, () -> svc.create(Actor.user(CREATOR),
                new SongSnapshot(null, null, null, null, "lyrics"), null, OwnerType.USER, null));
    }

    @Test
    void transferToCommunity_ShouldSnapshotOriginalBeforeChangingOwner() {
        SongEntity s = stored(1L, OwnerType.USER, String.valueOf(CREATOR));
        when(ownershipService.isOwner(s, CREATOR)).thenReturn(true);
        when(locator.groupId()).thenReturn(COMMUNITY);
        when(versionService.recordVersion(any(), anyLong(), anyString())).thenAnswer(inv -> {
            SongEntity current = inv.getArgument(0);
            assertEquals(OwnerType.USER, current.getOwnerType());
            return null;
        });

        SongEntity moved = svc.transferToCommunity(Actor.user(CREATOR), 1L);

        verify(versionService).recordVersion(s, CREATOR, SongServiceImpl.TRANSFER_DESCRIPTION);
        assertEquals(OwnerType.GROUP, moved.getOwnerType());
        assertEquals(String.valueOf(COMMUNITY), moved.getOwnerId());
        verify(songMapper).updateById(s);
    }

    @Test
    void transferToCommunity_ShouldValidate() {
        SongEntity s = stored(1L, OwnerType.USER, String.valueOf(CREATOR));

        UnauthorizedException e = assertThrows(UnauthorizedException.class, () -> svc.transferToCommunity(Actor.user(99L), 1L));
        assertEquals("creator_required", e.reason());

        when(ownershipService.isOwner(s, CREATOR)).thenReturn(true);
        assertThrows(NotFoundException.class, () -> svc.transferToCommunity(Actor.user(CREATOR), 1L));

        when(locator.groupId()).thenReturn(COMMUNITY);
        when(locator.isCommunityOwned(s)).thenReturn(true);
        InvalidStateException st = assertThrows(InvalidStateException.class, () -> svc.transferToCommunity(Actor.user(CREATOR), 1L));
        assertEquals("already_community_owned", st.reason());
        verifyNoInteractions(versionService);
    }

    @Test
    void reclaimFromCommunity_ShouldReturnToCreator() {
        SongEntity s = stored(1L, OwnerType.GROUP, String.valueOf(COMMUNITY));
        when(ownershipService.isOwner(s, CREATOR)).thenReturn(true);
        when(locator.isCommunityOwned(s)).thenReturn(true);

        SongEntity back = svc.reclaimFromCommunity(Actor.user(CREATOR), 1L);

        assertEquals(OwnerType.USER, back.getOwnerType());
        assertEquals(String.valueOf(CREATOR), back.getOwnerId());
    }

    @Test
    void reclaimFromCommunity_ShouldRejectContentOutsideCommunity() {
        SongEntity s = stored(1L, OwnerType.USER, String.valueOf(CREATOR));
        when(ownershipService.isOwner(s, CREATOR)).thenReturn(true);

        InvalidStateException e = assertThrows(InvalidStateException.class, () -> svc.reclaimFromCommunity(Actor.user(CREATOR), 1L));
        assertEquals("not_community_owned", e.reason());
    }

    @Test
    void requireSong_ShouldReportMissing() {
        assertThrows(NotFoundException.class, () -> svc.requireSong(404L));
        assertThrows(IllegalArgumentException.class, () -> svc.requireSong(0L));
    }
}
