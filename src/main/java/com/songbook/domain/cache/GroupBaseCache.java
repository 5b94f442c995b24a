package com.songbook.domain.cache;

import com.songbook.common.cache.CacheProperties;
import com.songbook.common.cache.RedisJsonCache;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.enums.JoinPolicy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

@Component
public class GroupBaseCache {

    private static final String KEY_PREFIX = "songbook:cache:group:base:";

    private final CacheProperties props;
    private final RedisJsonCache cache;

    public GroupBaseCache(CacheProperties props, RedisJsonCache cache) {
        this.props = props;
        this.cache = cache;
    }

    public Value get(long groupId) {
        if (!props.isEnabled() || groupId <= 0) {
            return null;
        }
        return cache.get(key(groupId), Value.class);
    }

    public void put(long groupId, Value value) {
        if (!props.isEnabled() || groupId <= 0 || value == null) {
            return;
        }
        cache.set(key(groupId), value, Duration.ofSeconds(Math.max(1, props.getGroupBaseTtlSeconds())));
    }

    public void evict(long groupId) {
        if (!props.isEnabled() || groupId <= 0) {
            return;
        }
        cache.delete(key(groupId));
    }

    private String key(long groupId) {
        return KEY_PREFIX + groupId;
    }

    public record Value(
            Long groupId,
            String name,
            String slug,
            String description,
            JoinPolicy joinPolicy,
            Boolean systemGroup,
            Long createdBy,
            LocalDateTime createdAt,
            LocalDateTime updatedAt
    ) {

        public static Value of(GroupEntity g) {
            return new Value(g.getId(), g.getName(), g.getSlug(), g.getDescription(), g.getJoinPolicy(),
                    g.getSystemGroup(), g.getCreatedBy(), g.getCreatedAt(), g.getUpdatedAt());
        }

        public GroupEntity toEntity() {
            GroupEntity g = new GroupEntity();
            g.setId(groupId);
            g.setName(name);
            g.setSlug(slug);
            g.setDescription(description);
            g.setJoinPolicy(joinPolicy);
            g.setSystemGroup(systemGroup);
            g.setCreatedBy(createdBy);
            g.setCreatedAt(createdAt);
            g.setUpdatedAt(updatedAt);
            return g;
        }
    }
}
