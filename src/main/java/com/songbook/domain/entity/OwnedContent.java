package com.songbook.domain.entity;

import com.songbook.domain.enums.ContentType;
import com.songbook.domain.enums.OwnerType;

/**
 * 歌曲/编曲共有的归属视图，权限判断和版本快照只依赖这几个字段。
 */
public interface OwnedContent {

    ContentType contentType();

    Long getId();

    Long getCreatedBy();

    OwnerType getOwnerType();

    /** GROUP 归属时为群 id 的字符串形式；USER 归属时为空或创建者 id。 */
    String getOwnerId();

    default boolean isGroupOwned() {
        return getOwnerType() == OwnerType.GROUP && getOwnerId() != null && !getOwnerId().isBlank();
    }

    /** 归属群 id；非群归属或 ownerId 不是数字时返回 null。 */
    default Long ownerGroupId() {
        if (!isGroupOwned()) {
            return null;
        }
        try {
            return Long.parseLong(getOwnerId().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
