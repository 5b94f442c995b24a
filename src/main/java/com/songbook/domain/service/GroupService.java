package com.songbook.domain.service;

import com.songbook.auth.Actor;
import com.songbook.domain.entity.GroupEntity;
import com.songbook.domain.enums.JoinPolicy;
import com.songbook.domain.enums.MemberRole;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 群的生命周期：创建、修改设置、解散、查询。成员治理见 {@link GroupManagementService}。
 */
public interface GroupService {

    GroupProfile createGroup(Actor actor, String name, String description, JoinPolicy joinPolicy);

    /** 只有群主可以修改；null 字段表示不修改。slug 创建后不变。 */
    GroupProfile updateGroup(Actor actor, long groupId, String name, String description, JoinPolicy joinPolicy);

    void deleteGroup(Actor actor, long groupId);

    GroupProfile profileById(Actor actor, long groupId);

    GroupProfile profileBySlug(Actor actor, String slug);

    /** 所有群及调用方在其中的角色（未登录时 myRole 为空）。 */
    List<GroupProfile> listGroups(Actor actor);

    List<GroupProfile> myGroups(Actor actor);

    /** 社区群；尚未创建时抛 NotFoundException。 */
    GroupProfile systemGroup(Actor actor);

    /** 读群（走缓存），不存在抛 NotFoundException。 */
    GroupEntity requireGroup(long groupId);

    /** 确保社区群存在：不存在则以 ownerUserId 为群主创建。幂等。 */
    GroupEntity ensureSystemGroup(long ownerUserId);

    record GroupProfile(
            Long groupId,
            String name,
            String slug,
            String description,
            JoinPolicy joinPolicy,
            Boolean systemGroup,
            Long createdBy,
            LocalDateTime createdAt,
            LocalDateTime updatedAt,
            Long memberCount,
            MemberRole myRole,
            Boolean isMember
    ) {
    }
}
