package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ministation.common.api.BizException;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.AuditLogEntity;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.mapper.AuditLogMapper;
import com.ministation.domain.mapper.StationMapper;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.PermissionResolver;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class AuditLogServiceImpl extends ServiceImpl<AuditLogMapper, AuditLogEntity> implements AuditLogService {

    private final StationMapper stationMapper;
    private final PermissionResolver permissionResolver;
    private final ObjectMapper objectMapper;
    private final StationProperties props;
    private final Clock clock;

    public AuditLogServiceImpl(StationMapper stationMapper,
                               PermissionResolver permissionResolver,
                               ObjectMapper objectMapper,
                               StationProperties props,
                               Clock clock) {
        this.stationMapper = stationMapper;
        this.permissionResolver = permissionResolver;
        this.objectMapper = objectMapper;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    @Override
    public void record(long stationId, AuditAction action, String actor, String target, Map<String, Object> details) {
        AuditLogEntity e = new AuditLogEntity();
        e.setStationId(stationId);
        e.setAuditAction(action);
        e.setActorPrincipal(actor);
        e.setTargetPrincipal(target);
        e.setDetails(toJson(details));
        e.setCreatedAt(LocalDateTime.now(clock));
        this.save(e);
    }

    @Override
    public List<AuditEntryDto> list(long stationId, String principal, Integer limit) {
        StationEntity station = stationMapper.selectById(stationId);
        if (station == null) {
            throw BizException.notFound("station_not_found");
        }
        permissionResolver.require(stationId, principal, Capability.SETTINGS, "no_audit_permission");

        int n = props.clampLimit(limit, props.getDefaultAuditLimit());
        List<AuditLogEntity> rows = this.list(new LambdaQueryWrapper<AuditLogEntity>()
                .eq(AuditLogEntity::getStationId, stationId)
                .orderByDesc(AuditLogEntity::getCreatedAt)
                .orderByDesc(AuditLogEntity::getId)
                .last("limit " + n));
        List<AuditEntryDto> out = new ArrayList<>(rows.size());
        for (AuditLogEntity r : rows) {
            out.add(new AuditEntryDto(r.getId(), r.getStationId(), r.getAuditAction(), r.getActorPrincipal(),
                    r.getTargetPrincipal(), r.getDetails(), r.getCreatedAt()));
        }
        return out;
    }

    private String toJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("audit_details_serialize_failed", e);
        }
    }
}
