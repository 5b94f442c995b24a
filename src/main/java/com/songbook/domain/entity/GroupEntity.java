package com.songbook.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.songbook.domain.enums.JoinPolicy;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_group")
public class GroupEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String name;

    /** 全局唯一，创建后不再变化。 */
    private String slug;

    private String description;

    private JoinPolicy joinPolicy;

    /** 系统群（社区/Public 群）：不可删除、不可改设置，群内内容走版本历史。 */
    private Boolean systemGroup;

    private Long createdBy;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public boolean isSystem() {
        return Boolean.TRUE.equals(systemGroup);
    }
}
