package com.songbook.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.songbook.domain.enums.ContentType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 个人内容的协作者/共同作者：与创建者一样拥有编辑权。
 */
@Data
@TableName("t_content_collaborator")
public class ContentCollaboratorEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private ContentType contentType;

    private Long contentId;

    private Long userId;

    private Long addedBy;

    private LocalDateTime addedAt;
}
