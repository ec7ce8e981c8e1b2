package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.AuditLogEntity;

public interface AuditLogMapper extends BaseMapper<AuditLogEntity> {
}
