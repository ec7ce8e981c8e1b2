package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.KarmaLedgerEntity;
import com.ministation.domain.entity.StationEntity;

import java.time.LocalDateTime;
import java.util.List;

public interface KarmaLedgerService extends IService<KarmaLedgerEntity> {

    /**
     * 按奖励表给 principal 记 karma：成员的 karmaEarnedHere、全局 externalKarma、
     * 派生的 promotionBoost 与 uniqueStationsHelped 在同一事务内更新。
     *
     * <p>station owner 不拿 karma；0 分的类型直接跳过。返回实际记入的分数。</p>
     */
    int award(StationEntity station, String principal, String type);

    /** 没有记录时返回默认值：0 karma、0 station、boost 1。 */
    KarmaDto getKarma(String principal);

    List<KarmaDto> leaderboard(Integer limit);

    List<StationKarmaDto> breakdown(String principal);

    /** 从成员表重建 ledger（内部修复用）。 */
    KarmaDto recalculate(String principal);

    record KarmaDto(
            String principal,
            Integer externalKarma,
            Integer uniqueStationsHelped,
            Double promotionBoost,
            LocalDateTime updatedAt
    ) {
    }

    record StationKarmaDto(
            Long stationId,
            String slug,
            String name,
            Integer karmaEarnedHere,
            boolean owner
    ) {
    }
}
