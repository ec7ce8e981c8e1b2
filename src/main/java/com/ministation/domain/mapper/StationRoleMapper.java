package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.StationRoleEntity;

public interface StationRoleMapper extends BaseMapper<StationRoleEntity> {
}
