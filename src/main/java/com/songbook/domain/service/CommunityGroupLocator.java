package com.songbook.domain.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.songbook.common.cache.CacheProperties;
import com.songbook.domain.config.CommunityProperties;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.entity.OwnedContent;
import com.songbook.domain.mapper.GroupMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 定位社区群（系统群）：先按 systemGroup 标记找，找不到再按配置的 slug 兜底。
 *
 * <p>社区群 id 几乎不会变，本机 Caffeine 缓存即可；没找到时不缓存。</p>
 */
@Slf4j
@Component
public class CommunityGroupLocator {

    private static final String LOCAL_KEY = "community";

    private final GroupMapper groupMapper;
    private final CommunityProperties communityProps;
    private final Cache<String, Long> local;

    public CommunityGroupLocator(GroupMapper groupMapper, CommunityProperties communityProps, CacheProperties cacheProps) {
        this.groupMapper = groupMapper;
        this.communityProps = communityProps;
        this.local = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, cacheProps.getCommunityGroupTtlSeconds())))
                .build();
    }

    /** 社区群 id；不存在时返回 null。 */
    public Long groupId() {
        Long hit = local.getIfPresent(LOCAL_KEY);
        if (hit != null) {
            return hit;
        }
        GroupEntity g = lookup();
        if (g == null || g.getId() == null) {
            log.debug("community group not found: slug={}", communityProps.getSlug());
            return null;
        }
        local.put(LOCAL_KEY, g.getId());
        return g.getId();
    }

    public GroupEntity find() {
        Long id = groupId();
        return id == null ? null : groupMapper.selectById(id);
    }

    public boolean isCommunityGroup(Long groupId) {
        if (groupId == null) {
            return false;
        }
        return groupId.equals(groupId());
    }

    public boolean isCommunityGroup(GroupEntity group) {
        if (group == null) {
            return false;
        }
        return group.isSystem() || isCommunityGroup(group.getId());
    }

    /** 内容当前是否归社区群所有（只有这类内容记录版本历史）。 */
    public boolean isCommunityOwned(OwnedContent content) {
        if (content == null) {
            return false;
        }
        Long ownerGroupId = content.ownerGroupId();
        return ownerGroupId != null && isCommunityGroup(ownerGroupId);
    }

    public void evict() {
        local.invalidate(LOCAL_KEY);
    }

    private GroupEntity lookup() {
        GroupEntity g = groupMapper.selectSystemGroup();
        if (g != null) {
            return g;
        }
        return groupMapper.selectBySlug(communityProps.getSlug());
    }
}
