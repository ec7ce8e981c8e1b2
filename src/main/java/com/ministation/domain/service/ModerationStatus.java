package com.ministation.domain.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.ministation.domain.entity.ModerationActionEntity;
import com.ministation.domain.enums.ModerationKind;
import com.ministation.domain.mapper.ModerationActionMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * “此刻是否受限”的惰性判定。
 *
 * <p>没有任何后台任务会把过期的记录置为 inactive：只有显式 lift 会改 active，
 * 过期完全由（expiresAt, now）比较得出。</p>
 */
@Component
@RequiredArgsConstructor
public class ModerationStatus {

    private final ModerationActionMapper moderationActionMapper;

    public static boolean isRestrictedAt(ModerationActionEntity action, LocalDateTime now) {
        if (action == null) {
            return false;
        }
        return isRestrictedAt(action.getActive(), action.getExpiresAt(), now);
    }

    public static boolean isRestrictedAt(Boolean active, LocalDateTime expiresAt, LocalDateTime now) {
        if (!Boolean.TRUE.equals(active)) {
            return false;
        }
        return expiresAt == null || expiresAt.isAfter(now);
    }

    public static boolean anyRestricting(List<ModerationActionEntity> actions, ModerationKind kind, LocalDateTime now) {
        if (actions == null) {
            return false;
        }
        for (ModerationActionEntity a : actions) {
            if (a.getKind() == kind && isRestrictedAt(a, now)) {
                return true;
            }
        }
        return false;
    }

    /** active=true 的全部记录（可能已经自然过期）。 */
    public List<ModerationActionEntity> activeActions(long stationId, String principal) {
        return moderationActionMapper.selectList(new LambdaQueryWrapper<ModerationActionEntity>()
                .eq(ModerationActionEntity::getStationId, stationId)
                .eq(ModerationActionEntity::getTargetPrincipal, principal)
                .eq(ModerationActionEntity::getActive, true)
                .orderByDesc(ModerationActionEntity::getIssuedAt));
    }

    public List<ModerationActionEntity> restrictingActions(long stationId, String principal, LocalDateTime now) {
        List<ModerationActionEntity> out = new ArrayList<>();
        for (ModerationActionEntity a : activeActions(stationId, principal)) {
            if (isRestrictedAt(a, now)) {
                out.add(a);
            }
        }
        return out;
    }

    /** 是否存在未被 lift 的封禁记录，不看是否过期。 */
    public boolean hasUnliftedBan(long stationId, String principal) {
        return moderationActionMapper.selectCount(new LambdaQueryWrapper<ModerationActionEntity>()
                .eq(ModerationActionEntity::getStationId, stationId)
                .eq(ModerationActionEntity::getTargetPrincipal, principal)
                .eq(ModerationActionEntity::getKind, ModerationKind.BAN)
                .eq(ModerationActionEntity::getActive, true)) > 0;
    }

    public boolean isBanned(long stationId, String principal, LocalDateTime now) {
        return anyRestricting(activeActions(stationId, principal), ModerationKind.BAN, now);
    }

    public boolean isMuted(long stationId, String principal, LocalDateTime now) {
        return anyRestricting(activeActions(stationId, principal), ModerationKind.MUTE, now);
    }
}
