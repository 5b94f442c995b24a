package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.AuthenticationRequiredException;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.enums.JoinPolicy;
import com.songbook.domain.enums.MemberRole;
import com.songbook.domain.service.GroupService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;

class GroupServiceImplTest {

    private InMemoryGroupStore store;
    private GroupServiceImpl svc;

    @BeforeEach
    void setUp() {
        store = new InMemoryGroupStore();
        svc = new GroupServiceImpl(
                store.groupMapper,
                store.memberMapper,
                store.requestMapper,
                store.groupBaseCache,
                store.locator,
                store.communityProps,
                store.clock
        );
    }

    @Test
    void createGroup_ShouldMakeCreatorSoleOwner() {
        GroupService.GroupProfile p = svc.createGroup(Actor.user(1L), "  Worship Team ", null, null);

        assertNotNull(p.groupId());
        assertEquals("Worship Team", p.name());
        assertEquals("worship-team", p.slug());
        assertEquals(JoinPolicy.APPROVAL, p.joinPolicy());
        assertEquals(MemberRole.OWNER, p.myRole());
        assertEquals(1L, p.memberCount());
        assertEquals(MemberRole.OWNER, store.roleOf(p.groupId(), 1L));
        assertEquals(1, store.ownerCount(p.groupId()));
    }

    @Test
    void createGroup_ShouldSuffixTakenSlug() {
        svc.createGroup(Actor.user(1L), "Youth", null, JoinPolicy.OPEN);
        GroupService.GroupProfile second = svc.createGroup(Actor.user(2L), "Youth", null, JoinPolicy.OPEN);

        assertEquals("youth-1", second.slug());
    }

    @Test
    void createGroup_ShouldValidateInputAndCaller() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> svc.createGroup(Actor.user(1L), "   ", null, null));
        assertEquals("missing_name", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> svc.createGroup(Actor.user(1L), "x".repeat(101), null, null));
        assertThrows(AuthenticationRequiredException.class, () -> svc.createGroup(Actor.anonymousUser(1L), "Team", null, null));
        assertTrue(store.groups.isEmpty());
    }

    @Test
    void updateGroup_ShouldOnlyAllowOwnerAndKeepSlug() {
        GroupService.GroupProfile p = svc.createGroup(Actor.user(1L), "Choir", null, null);
        store.member(p.groupId(), 2L, MemberRole.ADMIN);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> svc.updateGroup(Actor.user(2L), p.groupId(), "Hijack", null, null));
        assertEquals("owner_required", e.reason());

        GroupService.GroupProfile updated = svc.updateGroup(Actor.user(1L), p.groupId(), "Main Choir", "Sunday", JoinPolicy.OPEN);
        assertEquals("Main Choir", updated.name());
        assertEquals("choir", updated.slug());
        assertEquals(JoinPolicy.OPEN, updated.joinPolicy());
        verify(store.groupBaseCache).evict(p.groupId());
    }

    @Test
    void updateAndDelete_ShouldRefuseCommunityGroup() {
        store.communityGroup(50L);
        store.member(50L, 1L, MemberRole.OWNER);

        InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> svc.updateGroup(Actor.user(1L), 50L, "Renamed", null, null));
        assertEquals("system_group_immutable", e.reason());
        assertThrows(InvalidStateException.class, () -> svc.deleteGroup(Actor.user(1L), 50L));
        assertTrue(store.groups.containsKey(50L));
    }

    @Test
    void deleteGroup_ShouldRemoveMembersAndRequests() {
        GroupService.GroupProfile p = svc.createGroup(Actor.user(1L), "Band", null, null);
        store.member(p.groupId(), 2L, MemberRole.MEMBER);
        store.pendingRequest(p.groupId(), 3L);

        assertThrows(UnauthorizedException.class, () -> svc.deleteGroup(Actor.user(2L), p.groupId()));

        svc.deleteGroup(Actor.user(1L), p.groupId());
        assertFalse(store.groups.containsKey(p.groupId()));
        assertTrue(store.membersOf(p.groupId()).isEmpty());
        assertTrue(store.requests.isEmpty());
    }

    @Test
    void profileBySlug_ShouldReportCallerMembership() {
        GroupService.GroupProfile p = svc.createGroup(Actor.user(1L), "Band", null, null);

        GroupService.GroupProfile asOwner = svc.profileBySlug(Actor.user(1L), " BAND ");
        assertEquals(p.groupId(), asOwner.groupId());
        assertTrue(asOwner.isMember());

        GroupService.GroupProfile asGuest = svc.profileBySlug(Actor.NONE, "band");
        assertNull(asGuest.myRole());
        assertFalse(asGuest.isMember());

        assertThrows(NotFoundException.class, () -> svc.profileBySlug(Actor.NONE, "nope"));
    }

    @Test
    void ensureSystemGroup_ShouldCreateOnceAndBeFoundAfterwards() {
        assertThrows(NotFoundException.class, () -> svc.systemGroup(Actor.NONE));

        GroupEntity created = svc.ensureSystemGroup(7L);
        assertTrue(created.isSystem());
        assertEquals("public", created.getSlug());
        assertEquals(JoinPolicy.OPEN, created.getJoinPolicy());
        assertEquals(MemberRole.OWNER, store.roleOf(created.getId(), 7L));

        GroupEntity again = svc.ensureSystemGroup(8L);
        assertEquals(created.getId(), again.getId());
        assertEquals(1, store.groups.size());
        assertEquals(created.getId(), svc.systemGroup(Actor.NONE).groupId());
    }
}
