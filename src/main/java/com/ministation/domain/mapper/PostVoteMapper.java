package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.PostVoteEntity;

public interface PostVoteMapper extends BaseMapper<PostVoteEntity> {
}
