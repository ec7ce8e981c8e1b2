package com.ministation.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.ministation.domain.enums.AuditAction;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 特权操作审计。只追加，不修改不删除。
 */
@Data
@TableName("t_station_audit_log")
public class AuditLogEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long stationId;

    private AuditAction auditAction;

    private String actorPrincipal;

    private String targetPrincipal;

    /** JSON。 */
    private String details;

    private LocalDateTime createdAt;
}
