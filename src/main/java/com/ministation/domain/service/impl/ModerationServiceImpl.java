package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.ModerationActionEntity;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.ModerationKind;
import com.ministation.domain.mapper.ModerationActionMapper;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.ModerationService;
import com.ministation.domain.service.ModerationStatus;
import com.ministation.domain.service.PermissionResolver;
import com.ministation.domain.service.StationGuard;
import com.ministation.domain.service.StationMemberService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ModerationServiceImpl extends ServiceImpl<ModerationActionMapper, ModerationActionEntity> implements ModerationService {

    /** 100 年；再长会超出 DATETIME 上限。 */
    static final int MAX_DURATION_HOURS = 24 * 365 * 100;

    private final StationGuard stationGuard;
    private final PermissionResolver permissionResolver;
    private final StationMemberService memberService;
    private final ModerationStatus moderationStatus;
    private final AuditLogService auditLogService;
    private final StationProperties props;
    private final Clock clock;

    public ModerationServiceImpl(StationGuard stationGuard,
                                 PermissionResolver permissionResolver,
                                 StationMemberService memberService,
                                 ModerationStatus moderationStatus,
                                 AuditLogService auditLogService,
                                 StationProperties props,
                                 Clock clock) {
        this.stationGuard = stationGuard;
        this.permissionResolver = permissionResolver;
        this.memberService = memberService;
        this.moderationStatus = moderationStatus;
        this.auditLogService = auditLogService;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    @Override
    public ModerationDto ban(long stationId, String moderator, String target, String reason, Integer durationHours) {
        StationEntity station = stationGuard.requireStation(stationId);
        PermissionResolver.MemberAccess access =
                permissionResolver.require(stationId, moderator, Capability.BAN, "no_ban_permission");
        String t = requireTarget(target);
        if (StationGuard.isOwner(station, t)) {
            throw BizException.forbidden("cannot_ban_owner");
        }
        requireOutranks(station, moderator, access, t);
        if (durationHours != null) {
            requireDuration(durationHours);
        }
        String r = normalizeReason(reason);

        // 已过期但未 lift 的封禁也算已封禁，需先 unban
        if (moderationStatus.hasUnliftedBan(stationId, t)) {
            throw BizException.conflict("already_banned");
        }

        LocalDateTime now = LocalDateTime.now(clock);

        boolean wasMember = memberService.removeMember(stationId, t);
        ModerationActionEntity a = insertAction(stationId, t, ModerationKind.BAN, r, moderator, now,
                durationHours == null ? null : now.plusHours(durationHours));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", r);
        details.put("durationHours", durationHours);
        details.put("membershipRemoved", wasMember);
        auditLogService.record(stationId, AuditAction.MEMBER_BAN, moderator, t, details);
        log.info("member banned: station={} target={} by={} hours={}", stationId, t, moderator, durationHours);
        return ModerationDto.from(a);
    }

    @Transactional
    @Override
    public void unban(long stationId, String moderator, String target) {
        stationGuard.requireStation(stationId);
        permissionResolver.require(stationId, moderator, Capability.BAN, "no_ban_permission");
        String t = requireTarget(target);

        int lifted = lift(stationId, t, ModerationKind.BAN, moderator);
        if (lifted == 0) {
            throw BizException.notFound("not_banned");
        }
        auditLogService.record(stationId, AuditAction.MEMBER_UNBAN, moderator, t, null);
        log.info("member unbanned: station={} target={} by={}", stationId, t, moderator);
    }

    @Transactional
    @Override
    public ModerationDto mute(long stationId, String moderator, String target, String reason, Integer durationHours) {
        StationEntity station = stationGuard.requireStation(stationId);
        PermissionResolver.MemberAccess access =
                permissionResolver.require(stationId, moderator, Capability.BAN, "no_ban_permission");
        String t = requireTarget(target);
        if (StationGuard.isOwner(station, t)) {
            throw BizException.forbidden("cannot_mute_owner");
        }
        requireOutranks(station, moderator, access, t);
        if (durationHours == null) {
            throw BizException.validation("missing_duration");
        }
        requireDuration(durationHours);
        String r = normalizeReason(reason);

        LocalDateTime now = LocalDateTime.now(clock);
        ModerationActionEntity a = insertAction(stationId, t, ModerationKind.MUTE, r, moderator, now,
                now.plusHours(durationHours));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", r);
        details.put("durationHours", durationHours);
        auditLogService.record(stationId, AuditAction.MEMBER_MUTE, moderator, t, details);
        log.info("member muted: station={} target={} by={} hours={}", stationId, t, moderator, durationHours);
        return ModerationDto.from(a);
    }

    @Transactional
    @Override
    public int unmute(long stationId, String moderator, String target) {
        stationGuard.requireStation(stationId);
        permissionResolver.require(stationId, moderator, Capability.BAN, "no_ban_permission");
        String t = requireTarget(target);

        int lifted = lift(stationId, t, ModerationKind.MUTE, moderator);
        if (lifted == 0) {
            throw BizException.notFound("not_muted");
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lifted", lifted);
        auditLogService.record(stationId, AuditAction.MEMBER_UNMUTE, moderator, t, details);
        log.info("member unmuted: station={} target={} by={} lifted={}", stationId, t, moderator, lifted);
        return lifted;
    }

    @Override
    public MemberStatus memberStatus(long stationId, String principal) {
        stationGuard.requireStation(stationId);
        String p = requireTarget(principal);
        List<ModerationActionEntity> restricting = moderationStatus.restrictingActions(stationId, p, LocalDateTime.now(clock));
        boolean banned = false;
        boolean muted = false;
        List<ModerationDto> out = new ArrayList<>(restricting.size());
        for (ModerationActionEntity a : restricting) {
            banned |= a.getKind() == ModerationKind.BAN;
            muted |= a.getKind() == ModerationKind.MUTE;
            out.add(ModerationDto.from(a));
        }
        return new MemberStatus(banned, muted, out);
    }

    @Override
    public List<ModerationDto> listActive(long stationId, String principal) {
        stationGuard.requireStation(stationId);
        permissionResolver.require(stationId, principal, Capability.BAN, "no_ban_permission");
        List<ModerationActionEntity> rows = this.list(new LambdaQueryWrapper<ModerationActionEntity>()
                .eq(ModerationActionEntity::getStationId, stationId)
                .eq(ModerationActionEntity::getActive, true)
                .orderByDesc(ModerationActionEntity::getIssuedAt)
                .last("limit " + props.getMaxListLimit()));
        List<ModerationDto> out = new ArrayList<>(rows.size());
        for (ModerationActionEntity a : rows) {
            out.add(ModerationDto.from(a));
        }
        return out;
    }

    private ModerationActionEntity insertAction(long stationId, String target, ModerationKind kind, String reason,
                                                String issuedBy, LocalDateTime now, LocalDateTime expiresAt) {
        ModerationActionEntity a = new ModerationActionEntity();
        a.setStationId(stationId);
        a.setTargetPrincipal(target);
        a.setKind(kind);
        a.setReason(reason);
        a.setIssuedBy(issuedBy);
        a.setIssuedAt(now);
        a.setExpiresAt(expiresAt);
        a.setActive(true);
        this.save(a);
        return a;
    }

    /** 只改 active / liftedBy / liftedAt，记录本身保留。 */
    private int lift(long stationId, String target, ModerationKind kind, String liftedBy) {
        return baseMapper.update(null, new LambdaUpdateWrapper<ModerationActionEntity>()
                .eq(ModerationActionEntity::getStationId, stationId)
                .eq(ModerationActionEntity::getTargetPrincipal, target)
                .eq(ModerationActionEntity::getKind, kind)
                .eq(ModerationActionEntity::getActive, true)
                .set(ModerationActionEntity::getActive, false)
                .set(ModerationActionEntity::getLiftedBy, liftedBy)
                .set(ModerationActionEntity::getLiftedAt, LocalDateTime.now(clock)));
    }

    /**
     * 非 owner 的管理员不能处置与自己同级或更高的成员；非成员目标不受此限。
     */
    private void requireOutranks(StationEntity station, String moderator, PermissionResolver.MemberAccess access, String target) {
        if (StationGuard.isOwner(station, moderator)) {
            return;
        }
        PermissionResolver.MemberAccess t = permissionResolver.access(station.getId(), target);
        if (t != null && t.priority() >= access.priority()) {
            throw BizException.forbidden("target_outranks_moderator");
        }
    }

    private static void requireDuration(int durationHours) {
        if (durationHours <= 0 || durationHours > MAX_DURATION_HOURS) {
            throw BizException.validation("bad_duration");
        }
    }

    private static String requireTarget(String target) {
        String t = target == null ? "" : target.trim();
        if (t.isEmpty()) {
            throw BizException.validation("missing_target");
        }
        return t;
    }

    private String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return null;
        }
        String r = reason.trim();
        if (r.length() > props.getMaxReasonLength()) {
            throw BizException.validation("reason_too_long");
        }
        return r;
    }
}
