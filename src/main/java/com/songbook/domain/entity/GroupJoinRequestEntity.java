package com.songbook.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.songbook.domain.enums.GroupJoinRequestStatus;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_group_join_request")
public class GroupJoinRequestEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long groupId;

    private Long userId;

    private GroupJoinRequestStatus status;

    private LocalDateTime requestedAt;

    private Long resolvedBy;

    private LocalDateTime resolvedAt;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
