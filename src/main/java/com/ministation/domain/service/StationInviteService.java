package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.StationInviteEntity;

import java.time.LocalDateTime;
import java.util.List;

public interface StationInviteService extends IService<StationInviteEntity> {

    InviteDto createInvite(long stationId, String creator, CreateInviteCommand cmd);

    /**
     * 兑换邀请码。依次校验：存在、active、未过期、有余量、定向对象、station 可加入、未加入、未被封禁；
     * 每一项失败都有独立的原因码。
     */
    Redeemed useInvite(String code, String principal);

    void revokeInvite(long inviteId, String principal);

    /** 需要 promote 能力；只返回 active 的邀请。 */
    List<InviteDto> listInvites(long stationId, String principal);

    record CreateInviteCommand(
            String invitedPrincipal,
            String roleOnJoin,
            Integer maxUses,
            Integer expiresInHours
    ) {
    }

    record Redeemed(Long stationId, String role) {
    }

    record InviteDto(
            Long id,
            Long stationId,
            String inviteCode,
            String invitedPrincipal,
            String invitedBy,
            String roleOnJoin,
            Integer maxUses,
            Integer usedCount,
            LocalDateTime expiresAt,
            Boolean active,
            LocalDateTime createdAt
    ) {
        public static InviteDto from(StationInviteEntity i) {
            return new InviteDto(i.getId(), i.getStationId(), i.getInviteCode(), i.getInvitedPrincipal(),
                    i.getInvitedBy(), i.getRoleOnJoin(), i.getMaxUses(), i.getUsedCount(), i.getExpiresAt(),
                    i.getActive(), i.getCreatedAt());
        }
    }
}
