package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.StationEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

public interface StationMapper extends BaseMapper<StationEntity> {

    @Update("""
            update t_station
            set member_count = greatest(member_count + #{delta}, 0)
            where id = #{stationId}
            """)
    int adjustMemberCount(@Param("stationId") long stationId, @Param("delta") int delta);

    @Update("""
            update t_station
            set post_count = greatest(post_count + #{delta}, 0)
            where id = #{stationId}
            """)
    int adjustPostCount(@Param("stationId") long stationId, @Param("delta") int delta);
}
