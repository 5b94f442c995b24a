package com.songbook.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 群内角色（对应表字段：t_group_member.role）。
 *
 * <ul>
 *   <li>1 = 群主（OWNER），每个群有且只有一个</li>
 *   <li>2 = 管理员（ADMIN），按 promotedAt 排资历</li>
 *   <li>3 = 普通成员（MEMBER）</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum MemberRole {

    OWNER(1, "owner"),

    ADMIN(2, "admin"),

    MEMBER(3, "member");

    @EnumValue
    private final Integer code;

    private final String desc;
}
