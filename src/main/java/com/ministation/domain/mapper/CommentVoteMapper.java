package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.CommentVoteEntity;

public interface CommentVoteMapper extends BaseMapper<CommentVoteEntity> {
}
