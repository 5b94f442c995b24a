package com.songbook.domain.controller;

import com.songbook.domain.enums.OwnerType;

final class OwnerTypes {

    private OwnerTypes() {
    }

    /** 为空按个人归属处理。 */
    static OwnerType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return OwnerType.USER;
        }
        OwnerType t = OwnerType.fromString(raw);
        if (t == null) {
            throw new IllegalArgumentException("bad_owner_type");
        }
        return t;
    }
}
