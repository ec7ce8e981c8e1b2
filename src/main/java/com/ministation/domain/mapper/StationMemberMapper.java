package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.StationMemberEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

public interface StationMemberMapper extends BaseMapper<StationMemberEntity> {

    @Update("""
            update t_station_member
            set karma_earned_here = karma_earned_here + #{points}, updated_at = #{now}
            where station_id = #{stationId} and principal = #{principal}
            """)
    int addKarma(@Param("stationId") long stationId,
                 @Param("principal") String principal,
                 @Param("points") int points,
                 @Param("now") LocalDateTime now);

    /**
     * 该 principal 在“非自己拥有”的 station 中 karma 为正的数量。
     */
    @Select("""
            select count(*)
            from t_station_member m
            join t_station s on s.id = m.station_id
            where m.principal = #{principal}
              and m.karma_earned_here > 0
              and s.owner_principal <> #{principal}
            """)
    int countStationsHelped(@Param("principal") String principal);

    @Select("""
            select coalesce(sum(m.karma_earned_here), 0)
            from t_station_member m
            join t_station s on s.id = m.station_id
            where m.principal = #{principal}
              and s.owner_principal <> #{principal}
            """)
    int sumKarmaOutsideOwned(@Param("principal") String principal);
}
