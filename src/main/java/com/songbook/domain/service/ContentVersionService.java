package com.songbook.domain.service;

import com.songbook.auth.Actor;
import com.songbook.domain.dto.ContentSnapshot;
import com.songbook.domain.entity.ContentVersionEntity;
import com.songbook.domain.entity.OwnedContent;
import com.songbook.domain.enums.ContentType;

import java.util.List;

/**
 * 社区内容的版本历史。只有归社区群所有的内容才记录版本；每条版本保存的是编辑前的状态。
 */
public interface ContentVersionService {

    /**
     * 编辑落库前调用。
     *
     * @param current 当前已持久化的内容（编辑前）
     * @param after   编辑后的版本化字段
     * @return 是否新增了版本记录
     */
    boolean recordIfChanged(OwnedContent current, ContentSnapshot after, long actorId);

    /** 无条件追加一条当前状态的版本（带说明），例如转入社区前的原始版本。 */
    ContentVersionEntity recordVersion(OwnedContent content, long actorId, String description);

    /** 新的在前；limit 为空或不大于 0 时返回全部。无权访问时返回空列表。 */
    List<ContentVersionEntity> history(Actor actor, ContentType type, long contentId, Integer limit);

    ContentVersionEntity getVersion(Actor actor, ContentType type, long contentId, int version);

    /** 社区群群主/管理员，或内容的原始创建者。 */
    boolean canAccessHistory(Actor actor, ContentType type, long contentId);

    RollbackResult rollback(Actor actor, ContentType type, long contentId, int version);

    record RollbackResult(int restoredVersion, int recordedVersion) {
    }
}
