package com.songbook.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.songbook.domain.enums.ContentType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 内容版本记录：只追加，不修改、不删除。snapshot 是版本化字段的规范化 JSON（编辑前的状态）。
 */
@Data
@TableName("t_content_version")
public class ContentVersionEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private ContentType contentType;

    private Long contentId;

    /** 同一内容内从 1 开始递增。 */
    private Integer version;

    private String snapshot;

    private Long changedBy;

    private LocalDateTime changedAt;

    private String changeDescription;
}
