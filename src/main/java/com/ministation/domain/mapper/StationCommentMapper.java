package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.StationCommentEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

public interface StationCommentMapper extends BaseMapper<StationCommentEntity> {

    @Update("""
            update t_station_comment
            set upvotes = greatest(upvotes + #{up}, 0),
                downvotes = greatest(downvotes + #{down}, 0)
            where id = #{commentId}
            """)
    int applyVoteDelta(@Param("commentId") long commentId, @Param("up") int up, @Param("down") int down);
}
