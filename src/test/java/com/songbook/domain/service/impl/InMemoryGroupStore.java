package com.songbook.domain.service.impl;

import com.songbook.common.cache.CacheProperties;
import com.songbook.domain.cache.GroupBaseCache;
import com.songbook.domain.config.CommunityProperties;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.entity.GroupJoinRequestEntity;
import com.songbook.domain.entity.GroupMemberEntity;
import com.songbook.domain.enums.GroupJoinRequestStatus;
import com.songbook.domain.enums.JoinPolicy;
import com.songbook.domain.enums.MemberRole;
import com.songbook.domain.mapper.GroupJoinRequestMapper;
import com.songbook.domain.mapper.GroupMapper;
import com.songbook.domain.mapper.GroupMemberMapper;
import com.songbook.domain.service.CommunityGroupLocator;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * 测试用的群数据：mapper 都是 mock，读写落到这里的 Map 上，返回副本，
 * 条件更新按 revision / status 判断，行为与真实表一致。
 */
final class InMemoryGroupStore {

    final GroupMapper groupMapper = mock(GroupMapper.class);
    final GroupMemberMapper memberMapper = mock(GroupMemberMapper.class);
    final GroupJoinRequestMapper requestMapper = mock(GroupJoinRequestMapper.class);
    final GroupBaseCache groupBaseCache = mock(GroupBaseCache.class);
    final TickingClock clock = new TickingClock();
    final CommunityProperties communityProps = new CommunityProperties();
    final CommunityGroupLocator locator = new CommunityGroupLocator(groupMapper, communityProps, new CacheProperties());

    final Map<Long, GroupEntity> groups = new LinkedHashMap<>();
    final Map<Long, GroupMemberEntity> members = new LinkedHashMap<>();
    final Map<Long, GroupJoinRequestEntity> requests = new LinkedHashMap<>();

    private final AtomicLong ids = new AtomicLong(1000);

    private static final Comparator<GroupMemberEntity> LIST_ORDER = Comparator
            .comparing((GroupMemberEntity m) -> m.getRole().getCode())
            .thenComparing(GroupMemberEntity::getJoinedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(GroupMemberEntity::getId);

    InMemoryGroupStore() {
        wireGroups();
        wireMembers();
        wireRequests();
    }

    GroupEntity group(long id, JoinPolicy policy) {
        GroupEntity g = new GroupEntity();
        g.setId(id);
        g.setName("Group " + id);
        g.setSlug("group-" + id);
        g.setJoinPolicy(policy);
        g.setSystemGroup(false);
        groups.put(id, g);
        return g;
    }

    GroupEntity communityGroup(long id) {
        GroupEntity g = group(id, JoinPolicy.OPEN);
        g.setName("Public");
        g.setSlug("public");
        g.setSystemGroup(true);
        return g;
    }

    /** 管理员的 promotedAt 取当前时间，先加入的管理员更资深。 */
    GroupMemberEntity member(long groupId, long userId, MemberRole role) {
        LocalDateTime joinedAt = clock.next();
        return member(groupId, userId, role, joinedAt, role == MemberRole.ADMIN ? clock.next() : null);
    }

    GroupMemberEntity member(long groupId, long userId, MemberRole role, LocalDateTime joinedAt, LocalDateTime promotedAt) {
        GroupMemberEntity m = new GroupMemberEntity();
        m.setId(ids.incrementAndGet());
        m.setGroupId(groupId);
        m.setUserId(userId);
        m.setRole(role);
        m.setJoinedAt(joinedAt);
        m.setPromotedAt(promotedAt);
        m.setRevision(0);
        members.put(m.getId(), m);
        return copy(m);
    }

    GroupJoinRequestEntity pendingRequest(long groupId, long userId) {
        GroupJoinRequestEntity r = new GroupJoinRequestEntity();
        r.setId(ids.incrementAndGet());
        r.setGroupId(groupId);
        r.setUserId(userId);
        r.setStatus(GroupJoinRequestStatus.PENDING);
        r.setRequestedAt(clock.next());
        requests.put(r.getId(), r);
        return r;
    }

    GroupMemberEntity find(long groupId, long userId) {
        for (GroupMemberEntity m : members.values()) {
            if (m.getGroupId() == groupId && m.getUserId() == userId) {
                return m;
            }
        }
        return null;
    }

    MemberRole roleOf(long groupId, long userId) {
        GroupMemberEntity m = find(groupId, userId);
        return m == null ? null : m.getRole();
    }

    List<GroupMemberEntity> membersOf(long groupId) {
        List<GroupMemberEntity> out = new ArrayList<>();
        for (GroupMemberEntity m : members.values()) {
            if (m.getGroupId() == groupId) {
                out.add(m);
            }
        }
        out.sort(LIST_ORDER);
        return out;
    }

    long ownerCount(long groupId) {
        return membersOf(groupId).stream().filter(m -> m.getRole() == MemberRole.OWNER).count();
    }

    /** 模拟另一个事务先改了这一行。 */
    void bumpRevision(long groupId, long userId) {
        GroupMemberEntity m = find(groupId, userId);
        m.setRevision(m.getRevision() + 1);
    }

    private void wireGroups() {
        when(groupMapper.selectById(anyLong())).thenAnswer(inv -> groups.get(toLong(inv.getArgument(0))));
        when(groupMapper.selectSystemGroup()).thenAnswer(inv -> groups.values().stream()
                .filter(GroupEntity::isSystem)
                .findFirst()
                .orElse(null));
        when(groupMapper.selectBySlug(anyString())).thenAnswer(inv -> groups.values().stream()
                .filter(g -> Objects.equals(g.getSlug(), inv.getArgument(0)))
                .findFirst()
                .orElse(null));
        when(groupMapper.existsBySlug(anyString())).thenAnswer(inv -> groups.values().stream()
                .anyMatch(g -> Objects.equals(g.getSlug(), inv.getArgument(0))));
        when(groupMapper.insert(any(GroupEntity.class))).thenAnswer(inv -> {
            GroupEntity g = inv.getArgument(0);
            if (g.getId() == null) {
                g.setId(ids.incrementAndGet());
            }
            groups.put(g.getId(), g);
            return 1;
        });
        when(groupMapper.updateById(any(GroupEntity.class))).thenAnswer(inv -> {
            GroupEntity g = inv.getArgument(0);
            return groups.put(g.getId(), g) == null ? 0 : 1;
        });
        when(groupMapper.deleteById(anyLong())).thenAnswer(inv -> groups.remove(toLong(inv.getArgument(0))) == null ? 0 : 1);
    }

    private void wireMembers() {
        when(memberMapper.selectMember(anyLong(), anyLong())).thenAnswer(inv -> {
            GroupMemberEntity m = find(inv.getArgument(0), inv.getArgument(1));
            return m == null ? null : copy(m);
        });
        when(memberMapper.selectByGroup(anyLong())).thenAnswer(inv ->
                membersOf(inv.getArgument(0)).stream().map(InMemoryGroupStore::copy).toList());
        when(memberMapper.countByGroup(anyLong())).thenAnswer(inv -> (long) membersOf(inv.getArgument(0)).size());
        when(memberMapper.insert(any(GroupMemberEntity.class))).thenAnswer(inv -> {
            GroupMemberEntity m = inv.getArgument(0);
            if (find(m.getGroupId(), m.getUserId()) != null) {
                throw new org.springframework.dao.DuplicateKeyException("uk_group_user");
            }
            m.setId(ids.incrementAndGet());
            members.put(m.getId(), copy(m));
            return 1;
        });
        when(memberMapper.updateRole(any(), any(), any(), any())).thenAnswer(inv -> {
            GroupMemberEntity arg = inv.getArgument(0);
            GroupMemberEntity stored = members.get(arg.getId());
            int expected = arg.getRevision() == null ? 0 : arg.getRevision();
            if (stored == null || stored.getRevision() != expected) {
                return 0;
            }
            stored.setRole(inv.getArgument(1));
            stored.setPromotedAt(inv.getArgument(2));
            stored.setUpdatedAt(inv.getArgument(3));
            stored.setRevision(expected + 1);
            return 1;
        });
        when(memberMapper.deleteMember(any())).thenAnswer(inv -> {
            GroupMemberEntity arg = inv.getArgument(0);
            GroupMemberEntity stored = members.get(arg.getId());
            int expected = arg.getRevision() == null ? 0 : arg.getRevision();
            if (stored == null || stored.getRevision() != expected) {
                return 0;
            }
            members.remove(arg.getId());
            return 1;
        });
        when(memberMapper.deleteByGroup(anyLong())).thenAnswer(inv -> {
            long groupId = inv.getArgument(0);
            int before = members.size();
            members.values().removeIf(m -> m.getGroupId() == groupId);
            return before - members.size();
        });
    }

    private void wireRequests() {
        when(requestMapper.selectById(anyLong())).thenAnswer(inv -> {
            GroupJoinRequestEntity r = requests.get(toLong(inv.getArgument(0)));
            return r == null ? null : copy(r);
        });
        when(requestMapper.selectPending(anyLong(), anyLong())).thenAnswer(inv -> requests.values().stream()
                .filter(r -> r.getGroupId() == (long) inv.getArgument(0)
                        && r.getUserId() == (long) inv.getArgument(1)
                        && r.getStatus() == GroupJoinRequestStatus.PENDING)
                .map(InMemoryGroupStore::copy)
                .findFirst()
                .orElse(null));
        when(requestMapper.selectPendingByGroup(anyLong())).thenAnswer(inv -> requests.values().stream()
                .filter(r -> r.getGroupId() == (long) inv.getArgument(0)
                        && r.getStatus() == GroupJoinRequestStatus.PENDING)
                .map(InMemoryGroupStore::copy)
                .toList());
        when(requestMapper.insert(any(GroupJoinRequestEntity.class))).thenAnswer(inv -> {
            GroupJoinRequestEntity r = inv.getArgument(0);
            r.setId(ids.incrementAndGet());
            requests.put(r.getId(), copy(r));
            return 1;
        });
        when(requestMapper.transition(anyLong(), any(), any(), any())).thenAnswer(inv -> {
            GroupJoinRequestEntity r = requests.get((Long) inv.getArgument(0));
            if (r == null || r.getStatus() != GroupJoinRequestStatus.PENDING) {
                return 0;
            }
            r.setStatus(inv.getArgument(1));
            r.setResolvedBy(inv.getArgument(2));
            r.setResolvedAt(inv.getArgument(3));
            return 1;
        });
        when(requestMapper.deleteById(anyLong())).thenAnswer(inv -> requests.remove(toLong(inv.getArgument(0))) == null ? 0 : 1);
        when(requestMapper.deleteByGroup(anyLong())).thenAnswer(inv -> {
            long groupId = inv.getArgument(0);
            int before = requests.size();
            requests.values().removeIf(r -> r.getGroupId() == groupId);
            return before - requests.size();
        });
    }

    private static long toLong(Object id) {
        return ((Number) id).longValue();
    }

    static GroupMemberEntity copy(GroupMemberEntity src) {
        GroupMemberEntity m = new GroupMemberEntity();
        m.setId(src.getId());
        m.setGroupId(src.getGroupId());
        m.setUserId(src.getUserId());
        m.setRole(src.getRole());
        m.setJoinedAt(src.getJoinedAt());
        m.setPromotedAt(src.getPromotedAt());
        m.setInvitedBy(src.getInvitedBy());
        m.setRevision(src.getRevision());
        m.setCreatedAt(src.getCreatedAt());
        m.setUpdatedAt(src.getUpdatedAt());
        return m;
    }

    static GroupJoinRequestEntity copy(GroupJoinRequestEntity src) {
        GroupJoinRequestEntity r = new GroupJoinRequestEntity();
        r.setId(src.getId());
        r.setGroupId(src.getGroupId());
        r.setUserId(src.getUserId());
        r.setStatus(src.getStatus());
        r.setRequestedAt(src.getRequestedAt());
        r.setResolvedBy(src.getResolvedBy());
        r.setResolvedAt(src.getResolvedAt());
        return r;
    }

    /** 每次取时间都前进一秒，保证先后发生的操作时间戳严格递增。 */
    static final class TickingClock extends Clock {

        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        LocalDateTime next() {
            return LocalDateTime.ofInstant(instant(), ZoneOffset.UTC);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            now = now.plusSeconds(1);
            return now;
        }
    }
}
