package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.KarmaLedgerEntity;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.entity.StationMemberEntity;
import com.ministation.domain.mapper.KarmaLedgerMapper;
import com.ministation.domain.mapper.StationMapper;
import com.ministation.domain.mapper.StationMemberMapper;
import com.ministation.domain.service.KarmaLedgerService;
import com.ministation.domain.service.KarmaRewards;
import com.ministation.domain.service.StationGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class KarmaLedgerServiceImpl extends ServiceImpl<KarmaLedgerMapper, KarmaLedgerEntity> implements KarmaLedgerService {

    private final StationMemberMapper memberMapper;
    private final StationMapper stationMapper;
    private final StationProperties props;
    private final Clock clock;

    public KarmaLedgerServiceImpl(StationMemberMapper memberMapper,
                                  StationMapper stationMapper,
                                  StationProperties props,
                                  Clock clock) {
        this.memberMapper = memberMapper;
        this.stationMapper = stationMapper;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    @Override
    public int award(StationEntity station, String principal, String type) {
        if (station == null || station.getId() == null || principal == null || principal.isBlank()) {
            return 0;
        }
        // 不给 owner 自己的 station 记分
        if (StationGuard.isOwner(station, principal)) {
            return 0;
        }
        int points = KarmaRewards.pointsFor(type);
        if (points == 0) {
            return 0;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (memberMapper.addKarma(station.getId(), principal, points, now) == 0) {
            return 0;
        }
        ensureLedger(principal, now);
        baseMapper.addKarma(principal, points, now);
        refreshDerived(principal, now);
        log.debug("karma awarded: station={} principal={} type={} points={}", station.getId(), principal, type, points);
        return points;
    }

    @Override
    public KarmaDto getKarma(String principal) {
        String p = requirePrincipal(principal);
        KarmaLedgerEntity e = findLedger(p);
        if (e == null) {
            return new KarmaDto(p, 0, 0, KarmaRewards.promotionBoost(0), null);
        }
        return toDto(e);
    }

    @Override
    public List<KarmaDto> leaderboard(Integer limit) {
        int n = props.clampLimit(limit, props.getDefaultListLimit());
        List<KarmaLedgerEntity> rows = this.list(new LambdaQueryWrapper<KarmaLedgerEntity>()
                .gt(KarmaLedgerEntity::getExternalKarma, 0)
                .orderByDesc(KarmaLedgerEntity::getExternalKarma)
                .orderByAsc(KarmaLedgerEntity::getPrincipal)
                .last("limit " + n));
        List<KarmaDto> out = new ArrayList<>(rows.size());
        for (KarmaLedgerEntity e : rows) {
            out.add(toDto(e));
        }
        return out;
    }

    @Override
    public List<StationKarmaDto> breakdown(String principal) {
        String p = requirePrincipal(principal);
        List<StationMemberEntity> rows = memberMapper.selectList(new LambdaQueryWrapper<StationMemberEntity>()
                .eq(StationMemberEntity::getPrincipal, p)
                .orderByDesc(StationMemberEntity::getKarmaEarnedHere));
        if (rows.isEmpty()) {
            return List.of();
        }
        Set<Long> stationIds = new HashSet<>();
        for (StationMemberEntity m : rows) {
            stationIds.add(m.getStationId());
        }
        Map<Long, StationEntity> stations = new HashMap<>();
        for (StationEntity s : stationMapper.selectBatchIds(stationIds)) {
            stations.put(s.getId(), s);
        }
        List<StationKarmaDto> out = new ArrayList<>(rows.size());
        for (StationMemberEntity m : rows) {
            StationEntity s = stations.get(m.getStationId());
            if (s == null) {
                continue;
            }
            out.add(new StationKarmaDto(s.getId(), s.getSlug(), s.getName(), m.getKarmaEarnedHere(),
                    StationGuard.isOwner(s, p)));
        }
        return out;
    }

    @Transactional
    @Override
    public KarmaDto recalculate(String principal) {
        String p = requirePrincipal(principal);
        LocalDateTime now = LocalDateTime.now(clock);
        int total = memberMapper.sumKarmaOutsideOwned(p);
        ensureLedger(p, now);
        this.update(new LambdaUpdateWrapper<KarmaLedgerEntity>()
                .eq(KarmaLedgerEntity::getPrincipal, p)
                .set(KarmaLedgerEntity::getExternalKarma, total)
                .set(KarmaLedgerEntity::getUpdatedAt, now));
        refreshDerived(p, now);
        log.info("karma ledger recalculated: principal={} externalKarma={}", p, total);
        return toDto(findLedger(p));
    }

    private void ensureLedger(String principal, LocalDateTime now) {
        if (findLedger(principal) != null) {
            return;
        }
        KarmaLedgerEntity e = new KarmaLedgerEntity();
        e.setPrincipal(principal);
        e.setExternalKarma(0);
        e.setUniqueStationsHelped(0);
        e.setPromotionBoost(KarmaRewards.promotionBoost(0));
        e.setUpdatedAt(now);
        try {
            baseMapper.insert(e);
        } catch (DuplicateKeyException ex) {
            // 并发首次记分：另一个请求已经建好了行
            log.debug("karma ledger row created concurrently: {}", principal);
        }
    }

    /** promotionBoost 与 uniqueStationsHelped 都是派生值，每次记分后重算。 */
    private void refreshDerived(String principal, LocalDateTime now) {
        KarmaLedgerEntity e = findLedger(principal);
        if (e == null) {
            return;
        }
        int karma = e.getExternalKarma() == null ? 0 : e.getExternalKarma();
        this.update(new LambdaUpdateWrapper<KarmaLedgerEntity>()
                .eq(KarmaLedgerEntity::getId, e.getId())
                .set(KarmaLedgerEntity::getUniqueStationsHelped, memberMapper.countStationsHelped(principal))
                .set(KarmaLedgerEntity::getPromotionBoost, KarmaRewards.promotionBoost(karma))
                .set(KarmaLedgerEntity::getUpdatedAt, now));
    }

    private KarmaLedgerEntity findLedger(String principal) {
        return this.getOne(new LambdaQueryWrapper<KarmaLedgerEntity>()
                .eq(KarmaLedgerEntity::getPrincipal, principal)
                .last("limit 1"));
    }

    private static String requirePrincipal(String principal) {
        String p = principal == null ? "" : principal.trim();
        if (p.isEmpty()) {
            throw BizException.validation("missing_principal");
        }
        return p;
    }

    private static KarmaDto toDto(KarmaLedgerEntity e) {
        return new KarmaDto(e.getPrincipal(), e.getExternalKarma(), e.getUniqueStationsHelped(),
                e.getPromotionBoost(), e.getUpdatedAt());
    }
}
