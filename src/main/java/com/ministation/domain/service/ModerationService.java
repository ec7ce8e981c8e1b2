package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.ModerationActionEntity;
import com.ministation.domain.enums.ModerationKind;

import java.time.LocalDateTime;
import java.util.List;

public interface ModerationService extends IService<ModerationActionEntity> {

    /**
     * 封禁：移除成员身份（若有）并 memberCount-1；durationHours 为空表示永久。
     */
    ModerationDto ban(long stationId, String moderator, String target, String reason, Integer durationHours);

    /** 解除全部 active 的 ban；不会恢复成员身份。 */
    void unban(long stationId, String moderator, String target);

    /** 禁言：durationHours 必填；不动成员身份与计数。 */
    ModerationDto mute(long stationId, String moderator, String target, String reason, Integer durationHours);

    /** 返回被解除的禁言条数。 */
    int unmute(long stationId, String moderator, String target);

    MemberStatus memberStatus(long stationId, String principal);

    /** 需要 ban 能力；active=true 的全部记录（含已自然过期但未 lift 的）。 */
    List<ModerationDto> listActive(long stationId, String principal);

    record MemberStatus(boolean banned, boolean muted, List<ModerationDto> activeActions) {
    }

    record ModerationDto(
            Long id,
            Long stationId,
            String targetPrincipal,
            ModerationKind kind,
            String reason,
            String issuedBy,
            LocalDateTime issuedAt,
            LocalDateTime expiresAt,
            Boolean active,
            String liftedBy,
            LocalDateTime liftedAt
    ) {
        public static ModerationDto from(ModerationActionEntity a) {
            return new ModerationDto(a.getId(), a.getStationId(), a.getTargetPrincipal(), a.getKind(), a.getReason(),
                    a.getIssuedBy(), a.getIssuedAt(), a.getExpiresAt(), a.getActive(), a.getLiftedBy(), a.getLiftedAt());
        }
    }
}
