package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.StationInviteEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

public interface StationInviteMapper extends BaseMapper<StationInviteEntity> {

    /**
     * 兑换计数：单条语句里判断余量，返回 0 表示已用尽（并发下也不会超过 max_uses）。
     */
    @Update("""
            update t_station_invite
            set used_count = used_count + 1
            where id = #{inviteId}
              and active = true
              and (max_uses is null or used_count < max_uses)
            """)
    int incrementUsage(@Param("inviteId") long inviteId);
}
