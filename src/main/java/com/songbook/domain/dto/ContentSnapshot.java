package com.songbook.domain.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.songbook.domain.enums.ContentType;

/**
 * 版本化字段的快照。只包含参与版本比较的字段，统计类和归属类字段不在其中。
 */
public interface ContentSnapshot {

    @JsonIgnore
    ContentType contentType();
}
