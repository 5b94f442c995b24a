package com.songbook.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.songbook.domain.enums.MemberRole;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_group_member")
public class GroupMemberEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long groupId;

    private Long userId;

    /** 成员角色：见 {@link MemberRole}（数据库存数字）。 */
    private MemberRole role;

    private LocalDateTime joinedAt;

    /** 成为管理员的时间，只有 ADMIN 有值；越早越资深。 */
    private LocalDateTime promotedAt;

    /** 通过审批入群时记录审批人。 */
    private Long invitedBy;

    /** 行版本号：角色变更/删除都带上它做 compare-and-swap。 */
    private Integer revision;

    @TableField(fill = FieldFill.INSERT)
    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;
}
