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
 * 编曲（某首歌的一个 ChordPro 版本）。rating/favorites 是冗余统计，不进版本快照。
 */
@Data
@TableName(value = "t_arrangement", autoResultMap = true)
public class ArrangementEntity implements OwnedContent {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long songId;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String name;

    /** 调号；key 是 MySQL 关键字，列名用 musical_key。 */
    @TableField(value = "musical_key", updateStrategy = FieldStrategy.IGNORED)
    private String musicalKey;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private Integer tempo;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private Integer capo;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String timeSignature;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String chordProContent;

    @TableField(typeHandler = JacksonTypeHandler.class, updateStrategy = FieldStrategy.IGNORED)
    private List<String> tags;

    private String slug;

    private Long createdBy;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private OwnerType ownerType;

    @TableField(updateStrategy = FieldStrategy.IGNORED)
    private String ownerId;

    private Double rating;

    private Integer favorites;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    @Override
    public ContentType contentType() {
        return ContentType.ARRANGEMENT;
    }
}
