package com.songbook.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.songbook.domain.enums.ContentType;
import com.songbook.domain.enums.OwnerType;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 歌曲。title/artist/themes/copyright/lyrics 是版本化字段：updateById 时总是写入（允许清空）。
 */
@Data
@TableName(value = "t_song", autoResultMap = true)
public class SongEntity implements OwnedContent {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String title;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String artist;

    @TableField(typeHandler = JacksonTypeHandler.class, updateStrategy = FieldStrategy.IGNORED)
    private List<String> themes;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String copyright;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String lyrics;

    private String slug;

    private Long createdBy;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private OwnerType ownerType;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String ownerId;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    @Override
    public ContentType contentType() {
        return ContentType.SONG;
    }
}
