package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.enums.StationStatus;

import java.time.LocalDateTime;
import java.util.List;

public interface StationService extends IService<StationEntity> {

    /**
     * 建站：station、四个系统角色与 owner 的 captain 成员身份在同一事务内落库，memberCount=1。
     */
    CreatedStation create(String ownerPrincipal, String name, String description);

    StationDto update(long stationId, String principal, String name, String description);

    void archive(long stationId, String principal);

    StationDto get(long stationId);

    StationDto getBySlug(String slug);

    /** active 状态，按创建时间倒序。 */
    List<StationDto> listActive(Integer limit);

    record CreatedStation(Long stationId, String slug) {
    }

    record StationDto(
            Long id,
            String slug,
            String name,
            String description,
            String ownerPrincipal,
            Integer memberCount,
            Integer postCount,
            StationStatus status,
            LocalDateTime createdAt,
            LocalDateTime updatedAt
    ) {
        public static StationDto from(StationEntity s) {
            return new StationDto(s.getId(), s.getSlug(), s.getName(), s.getDescription(), s.getOwnerPrincipal(),
                    s.getMemberCount(), s.getPostCount(), s.getStatus(), s.getCreatedAt(), s.getUpdatedAt());
        }
    }
}
