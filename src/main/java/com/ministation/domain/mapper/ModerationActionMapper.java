package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.ModerationActionEntity;

public interface ModerationActionMapper extends BaseMapper<ModerationActionEntity> {
}
