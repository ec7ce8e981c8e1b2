package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.AuditLogEntity;
import com.ministation.domain.enums.AuditAction;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public interface AuditLogService extends IService<AuditLogEntity> {

    /**
     * 追加一条审计记录；必须在调用方的事务里执行，失败则整体回滚。
     */
    void record(long stationId, AuditAction action, String actor, String target, Map<String, Object> details);

    /** 需要 settings 能力；按时间倒序。 */
    List<AuditEntryDto> list(long stationId, String principal, Integer limit);

    record AuditEntryDto(
            Long id,
            Long stationId,
            AuditAction action,
            String actorPrincipal,
            String targetPrincipal,
            String details,
            LocalDateTime createdAt
    ) {
    }
}
