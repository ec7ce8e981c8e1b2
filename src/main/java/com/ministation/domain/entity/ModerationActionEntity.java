package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.ministation.domain.enums.ModerationKind;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 封禁/禁言记录。只会被 lift（active=false），从不物理删除。
 */
@Data
@TableName("t_station_moderation")
public class ModerationActionEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long stationId;

    private String targetPrincipal;

    private ModerationKind kind;

    private String reason;

    private String issuedBy;

    private LocalDateTime issuedAt;

    /** 为空表示永久（只有 ban 允许）。 */
    private LocalDateTime expiresAt;

    private Boolean active;

    private String liftedBy;

    private LocalDateTime liftedAt;
}
