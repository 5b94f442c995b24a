package com.songbook.domain.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.songbook.domain.dto.ArrangementSnapshot;
import com.songbook.domain.dto.ContentSnapshot;
import com.songbook.domain.dto.SongSnapshot;
import com.songbook.domain.entity.ArrangementEntity;
import com.songbook.domain.entity.OwnedContent;
import com.songbook.domain.entity.SongEntity;
import com.songbook.domain.enums.ContentType;
import org.springframework.stereotype.Component;

/**
 * 快照的规范化 JSON 编解码：键按字母序、省略 null，同样的字段值总是得到同样的字符串，
 * 因此“是否有变化”可以直接比较字符串。
 */
@Component
public class ContentSnapshotCodec {

    private final ObjectMapper mapper;

    public ContentSnapshotCodec() {
        this.mapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    public ContentSnapshot snapshotOf(OwnedContent content) {
        if (content instanceof SongEntity s) {
            return SongSnapshot.of(s);
        }
        if (content instanceof ArrangementEntity a) {
            return ArrangementSnapshot.of(a);
        }
        throw new IllegalArgumentException("unsupported_content_type");
    }

    public String encode(ContentSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("snapshot encode failed", e);
        }
    }

    public ContentSnapshot decode(ContentType type, String json) {
        Class<? extends ContentSnapshot> target = type == ContentType.SONG ? SongSnapshot.class : ArrangementSnapshot.class;
        try {
            return mapper.readValue(json, target);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("snapshot decode failed: type=" + type, e);
        }
    }

    /** 把快照写回实体的版本化字段。 */
    public void apply(ContentSnapshot snapshot, OwnedContent content) {
        if (snapshot instanceof SongSnapshot s && content instanceof SongEntity song) {
            s.applyTo(song);
        } else if (snapshot instanceof ArrangementSnapshot a && content instanceof ArrangementEntity arrangement) {
            a.applyTo(arrangement);
        } else {
            throw new IllegalArgumentException("snapshot_type_mismatch");
        }
    }
}
