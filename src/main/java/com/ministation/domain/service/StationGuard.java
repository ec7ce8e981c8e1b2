package com.ministation.domain.service;

import com.ministation.common.api.BizException;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.enums.StationStatus;
import com.ministation.domain.mapper.StationMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 各 service 共用的 station 前置检查。
 */
@Component
@RequiredArgsConstructor
public class StationGuard {

    private final StationMapper stationMapper;

    public StationEntity requireStation(long stationId) {
        StationEntity station = stationId <= 0 ? null : stationMapper.selectById(stationId);
        if (station == null) {
            throw BizException.notFound("station_not_found");
        }
        return station;
    }

    /** 归档后只读：加入、兑换邀请、发帖、评论都拒绝。 */
    public StationEntity requireActive(long stationId) {
        StationEntity station = requireStation(stationId);
        if (station.getStatus() != StationStatus.ACTIVE) {
            throw BizException.invalidState("station_not_active");
        }
        return station;
    }

    public static boolean isOwner(StationEntity station, String principal) {
        return station != null && principal != null && principal.equals(station.getOwnerPrincipal());
    }
}
