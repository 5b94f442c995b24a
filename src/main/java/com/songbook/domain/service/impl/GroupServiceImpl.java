package com.songbook.domain.service.impl;

import com.songbook.auth.Actor;
import com.songbook.common.error.InvalidStateException;
import com.songbook.common.error.NotFoundException;
import com.songbook.common.error.UnauthorizedException;
import com.songbook.common.util.Slugs;
import com.songbook.domain.cache.GroupBaseCache;
import com.songbook.domain.config.CommunityProperties;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.enums.JoinPolicy;
import com.songbook.domain.enums.MemberRole;
import com.songbook.domain.mapper.GroupJoinRequestMapper;
import com.songbook.domain.mapper.GroupMapper;
import com.songbook.domain.mapper.GroupMemberMapper;
import com.songbook.domain.service.CommunityGroupLocator;
import com.songbook.domain.service.GroupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GroupServiceImpl implements GroupService {

    private static final int NAME_MAX_LENGTH = 100;
    private static final int DESCRIPTION_MAX_LENGTH = 1000;

    private final GroupMapper groupMapper;
    private final GroupMemberMapper groupMemberMapper;
    private final GroupJoinRequestMapper groupJoinRequestMapper;
    private final GroupBaseCache groupBaseCache;
    private final CommunityGroupLocator communityGroupLocator;
    private final CommunityProperties communityProps;
    private final Clock clock;

    @Transactional
    @Override
    public GroupProfile createGroup(Actor actor, String name, String description, JoinPolicy joinPolicy) {
        long uid = actor.requireRegistered();
        String n = normalizeName(name);
        if (n == null) {
            throw new IllegalArgumentException("missing_name");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        GroupEntity g = new GroupEntity();
        g.setName(n);
        g.setSlug(Slugs.unique(n, "group", groupMapper::existsBySlug));
        g.setDescription(normalizeDescription(description));
        g.setJoinPolicy(joinPolicy == null ? JoinPolicy.APPROVAL : joinPolicy);
        g.setSystemGroup(false);
        g.setCreatedBy(uid);
        groupMapper.insert(g);

        insertOwner(g.getId(), uid, now);
        log.info("group created: groupId={}, slug={}, ownerId={}", g.getId(), g.getSlug(), uid);
        return toProfile(g, 1L, MemberRole.OWNER);
    }

    @Transactional
    @Override
    public GroupProfile updateGroup(Actor actor, long groupId, String name, String description, JoinPolicy joinPolicy) {
        long uid = actor.requireUserId();
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null || me.getRole() != MemberRole.OWNER) {
            throw new UnauthorizedException("owner_required");
        }
        GroupEntity g = groupMapper.selectById(groupId);
        if (g == null) {
            throw new NotFoundException("group_not_found");
        }
        if (communityGroupLocator.isCommunityGroup(g)) {
            throw new InvalidStateException("system_group_immutable");
        }

        if (name != null) {
            String n = normalizeName(name);
            if (n == null) {
                throw new IllegalArgumentException("missing_name");
            }
            g.setName(n);
        }
        if (description != null) {
            g.setDescription(normalizeDescription(description));
        }
        if (joinPolicy != null) {
            g.setJoinPolicy(joinPolicy);
        }
        g.setUpdatedAt(LocalDateTime.now(clock));
        groupMapper.updateById(g);
        groupBaseCache.evict(groupId);
        log.info("group updated: groupId={}, actorId={}", groupId, uid);
        return toProfile(g, groupMemberMapper.countByGroup(groupId), me.getRole());
    }

    @Transactional
    @Override
    public void deleteGroup(Actor actor, long groupId) {
        long uid = actor.requireUserId();
        GroupMemberEntity me = groupMemberMapper.selectMember(groupId, uid);
        if (me == null || me.getRole() != MemberRole.OWNER) {
            throw new UnauthorizedException("owner_required");
        }
        GroupEntity g = groupMapper.selectById(groupId);
        if (g == null) {
            throw new NotFoundException("group_not_found");
        }
        if (communityGroupLocator.isCommunityGroup(g)) {
            throw new InvalidStateException("system_group_immutable");
        }
        groupJoinRequestMapper.deleteByGroup(groupId);
        groupMemberMapper.deleteByGroup(groupId);
        groupMapper.deleteById(groupId);
        groupBaseCache.evict(groupId);
        log.info("group deleted: groupId={}, actorId={}", groupId, uid);
    }

    @Override
    public GroupProfile profileById(Actor actor, long groupId) {
        GroupEntity g = requireGroup(groupId);
        return profileOf(actor, g);
    }

    @Override
    public GroupProfile profileBySlug(Actor actor, String slug) {
        String s = slug == null ? "" : slug.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("missing_slug");
        }
        GroupEntity g = groupMapper.selectBySlug(s);
        if (g == null) {
            throw new NotFoundException("group_not_found");
        }
        return profileOf(actor, g);
    }

    @Override
    public List<GroupProfile> listGroups(Actor actor) {
        List<GroupEntity> groups = groupMapper.selectList(null);
        if (groups == null || groups.isEmpty()) {
            return List.of();
        }
        List<GroupProfile> out = new ArrayList<>(groups.size());
        for (GroupEntity g : groups) {
            if (g != null && g.getId() != null) {
                out.add(profileOf(actor, g));
            }
        }
        return out;
    }

    @Override
    public List<GroupProfile> myGroups(Actor actor) {
        long uid = actor.requireUserId();
        List<GroupEntity> groups = groupMapper.selectGroupsForUser(uid);
        if (groups == null || groups.isEmpty()) {
            return List.of();
        }
        List<GroupProfile> out = new ArrayList<>(groups.size());
        for (GroupEntity g : groups) {
            if (g != null && g.getId() != null) {
                out.add(profileOf(actor, g));
            }
        }
        return out;
    }

    @Override
    public GroupProfile systemGroup(Actor actor) {
        GroupEntity g = communityGroupLocator.find();
        if (g == null) {
            throw new NotFoundException("system_group_not_found");
        }
        return profileOf(actor, g);
    }

    @Override
    public GroupEntity requireGroup(long groupId) {
        if (groupId <= 0) {
            throw new IllegalArgumentException("bad_group_id");
        }
        GroupBaseCache.Value cached = groupBaseCache.get(groupId);
        if (cached != null) {
            return cached.toEntity();
        }
        GroupEntity g = groupMapper.selectById(groupId);
        if (g == null) {
            throw new NotFoundException("group_not_found");
        }
        groupBaseCache.put(groupId, GroupBaseCache.Value.of(g));
        return g;
    }

    @Transactional
    @Override
    public GroupEntity ensureSystemGroup(long ownerUserId) {
        GroupEntity existing = communityGroupLocator.find();
        if (existing != null) {
            return existing;
        }
        if (ownerUserId <= 0) {
            throw new IllegalArgumentException("bad_owner_id");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        GroupEntity g = new GroupEntity();
        g.setName(communityProps.getName());
        g.setSlug(Slugs.unique(communityProps.getSlug(), "public", groupMapper::existsBySlug));
        g.setDescription("Community-owned songs and arrangements");
        g.setJoinPolicy(JoinPolicy.OPEN);
        g.setSystemGroup(true);
        g.setCreatedBy(ownerUserId);
        groupMapper.insert(g);
        insertOwner(g.getId(), ownerUserId, now);
        communityGroupLocator.evict();
        log.info("system group created: groupId={}, slug={}, ownerId={}", g.getId(), g.getSlug(), ownerUserId);
        return g;
    }

    private void insertOwner(Long groupId, long userId, LocalDateTime now) {
        GroupMemberEntity m = new GroupMemberEntity();
        m.setGroupId(groupId);
        m.setUserId(userId);
        m.setRole(MemberRole.OWNER);
        m.setJoinedAt(now);
        m.setRevision(0);
        groupMemberMapper.insert(m);
    }

    private GroupProfile profileOf(Actor actor, GroupEntity g) {
        MemberRole myRole = null;
        if (actor != null && actor.isAuthenticated()) {
            GroupMemberEntity me = groupMemberMapper.selectMember(g.getId(), actor.userId());
            myRole = me == null ? null : me.getRole();
        }
        return toProfile(g, groupMemberMapper.countByGroup(g.getId()), myRole);
    }

    private static GroupProfile toProfile(GroupEntity g, long memberCount, MemberRole myRole) {
        return new GroupProfile(
                g.getId(),
                g.getName(),
                g.getSlug(),
                g.getDescription(),
                g.getJoinPolicy(),
                g.isSystem(),
                g.getCreatedBy(),
                g.getCreatedAt(),
                g.getUpdatedAt(),
                memberCount,
                myRole,
                myRole != null
        );
    }

    private static String normalizeName(String name) {
        String n = name == null ? "" : name.trim();
        if (n.isEmpty()) {
            return null;
        }
        if (n.length() > NAME_MAX_LENGTH) {
            throw new IllegalArgumentException("name_too_long");
        }
        return n;
    }

    private static String normalizeDescription(String description) {
        if (description == null) {
            return null;
        }
        String d = description.trim();
        if (d.length() > DESCRIPTION_MAX_LENGTH) {
            throw new IllegalArgumentException("description_too_long");
        }
        return d.isEmpty() ? null : d;
    }
}
