package com.songbook.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 入群申请状态。APPROVED/REJECTED 为终态；申请人撤回直接删除记录，不占状态值。
 */
@Getter
@RequiredArgsConstructor
public enum GroupJoinRequestStatus {

    PENDING(1, "pending"),
    APPROVED(2, "approved"),
    REJECTED(3, "rejected");

    @EnumValue
    private final Integer code;

    private final String desc;
}
