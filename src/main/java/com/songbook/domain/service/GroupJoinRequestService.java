package com.songbook.domain.service;

import com.songbook.auth.Actor;
import com.songbook.domain.entity.GroupJoinRequestEntity;

import java.util.List;

/**
 * 入群申请状态机：PENDING -> APPROVED | REJECTED（终态）；申请人撤回 = 删除 PENDING 记录。
 */
public interface GroupJoinRequestService {

    /**
     * 开放群直接入群，审批群创建 PENDING 申请。
     */
    JoinResult requestJoin(Actor actor, long groupId);

    /** 只创建申请；开放群抛 InvalidStateException。 */
    GroupJoinRequestEntity createRequest(Actor actor, long groupId);

    void cancelRequest(Actor actor, long groupId);

    GroupJoinRequestEntity approve(Actor actor, long requestId);

    GroupJoinRequestEntity reject(Actor actor, long requestId);

    /**
     * @param action approve | reject
     */
    GroupJoinRequestEntity decide(Actor actor, long requestId, String action);

    /** 群的待审批申请；没有审批权限时返回空列表。 */
    List<GroupJoinRequestEntity> listPending(Actor actor, long groupId);

    /** 调用方在该群的待审批申请，没有时返回 null。 */
    GroupJoinRequestEntity myPendingRequest(Actor actor, long groupId);

    record JoinResult(boolean joined, Long requestId) {
    }
}
