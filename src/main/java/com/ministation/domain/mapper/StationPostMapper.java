package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.StationPostEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

public interface StationPostMapper extends BaseMapper<StationPostEntity> {

    /**
     * 两个计数在同一条 update 里变化：翻转投票时不会出现中间态。
     */
    @Update("""
            update t_station_post
            set upvotes = greatest(upvotes + #{up}, 0),
                downvotes = greatest(downvotes + #{down}, 0)
            where id = #{postId}
            """)
    int applyVoteDelta(@Param("postId") long postId, @Param("up") int up, @Param("down") int down);

    @Update("""
            update t_station_post
            set comment_count = greatest(comment_count + #{delta}, 0)
            where id = #{postId}
            """)
    int adjustCommentCount(@Param("postId") long postId, @Param("delta") int delta);
}
