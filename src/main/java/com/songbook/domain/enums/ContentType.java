package com.songbook.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ContentType {

    SONG(1, "song"),

    ARRANGEMENT(2, "arrangement");

    @EnumValue
    private final Integer code;

    private final String desc;

    public static ContentType fromString(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "song" -> SONG;
            case "arrangement" -> ARRANGEMENT;
            default -> null;
        };
    }
}
