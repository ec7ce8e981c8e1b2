package com.ministation.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.ministation.domain.entity.KarmaLedgerEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

public interface KarmaLedgerMapper extends BaseMapper<KarmaLedgerEntity> {

    @Update("""
            update t_karma_ledger
            set external_karma = external_karma + #{points}, updated_at = #{now}
            where principal = #{principal}
            """)
    int addKarma(@Param("principal") String principal, @Param("points") int points, @Param("now") LocalDateTime now);
}
