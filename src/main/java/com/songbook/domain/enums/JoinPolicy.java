package com.songbook.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum JoinPolicy {

    /** 申请即加入 */
    OPEN(1, "open"),

    /** 需要群主/管理员审批 */
    APPROVAL(2, "approval");

    @EnumValue
    private final Integer code;

    private final String desc;

    public static JoinPolicy fromString(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "open" -> OPEN;
            case "approval" -> APPROVAL;
            default -> null;
        };
    }
}
