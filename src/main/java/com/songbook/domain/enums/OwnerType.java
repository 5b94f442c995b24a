package com.songbook.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 内容归属类型。库里为空按 USER 处理（历史数据没有这一列）。
 */
@Getter
@RequiredArgsConstructor
public enum OwnerType {

    USER(1, "user"),

    GROUP(2, "group");

    @EnumValue
    private final Integer code;

    private final String desc;

    public static OwnerType fromString(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "user" -> USER;
            case "group" -> GROUP;
            default -> null;
        };
    }
}
