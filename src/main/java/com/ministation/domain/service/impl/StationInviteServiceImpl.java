package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.entity.StationInviteEntity;
import com.ministation.domain.entity.StationRoleEntity;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.SystemRole;
import com.ministation.domain.mapper.StationInviteMapper;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.InviteCodeService;
import com.ministation.domain.service.ModerationStatus;
import com.ministation.domain.service.PermissionResolver;
import com.ministation.domain.service.StationGuard;
import com.ministation.domain.service.StationInviteService;
import com.ministation.domain.service.StationMemberService;
import com.ministation.domain.service.StationRoleService;
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
public class StationInviteServiceImpl extends ServiceImpl<StationInviteMapper, StationInviteEntity> implements StationInviteService {

    private static final int MAX_CODE_LEN = 16;

    private final StationGuard stationGuard;
    private final PermissionResolver permissionResolver;
    private final StationRoleService roleService;
    private final StationMemberService memberService;
    private final ModerationStatus moderationStatus;
    private final InviteCodeService inviteCodeService;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public StationInviteServiceImpl(StationGuard stationGuard,
                                    PermissionResolver permissionResolver,
                                    StationRoleService roleService,
                                    StationMemberService memberService,
                                    ModerationStatus moderationStatus,
                                    InviteCodeService inviteCodeService,
                                    AuditLogService auditLogService,
                                    Clock clock) {
        this.stationGuard = stationGuard;
        this.permissionResolver = permissionResolver;
        this.roleService = roleService;
        this.memberService = memberService;
        this.moderationStatus = moderationStatus;
        this.inviteCodeService = inviteCodeService;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional
    @Override
    public InviteDto createInvite(long stationId, String creator, CreateInviteCommand cmd) {
        stationGuard.requireActive(stationId);
        PermissionResolver.MemberAccess access =
                permissionResolver.require(stationId, creator, Capability.PROMOTE, "no_invite_permission");

        CreateInviteCommand c = cmd == null ? new CreateInviteCommand(null, null, null, null) : cmd;
        String roleSlug = c.roleOnJoin() == null || c.roleOnJoin().isBlank()
                ? SystemRole.CREW.getSlug()
                : c.roleOnJoin().trim();
        StationRoleEntity role = roleService.requireAssignable(stationId, access, roleSlug);

        if (c.maxUses() != null && c.maxUses() <= 0) {
            throw BizException.validation("bad_max_uses");
        }
        if (c.expiresInHours() != null && c.expiresInHours() <= 0) {
            throw BizException.validation("bad_expiry");
        }
        String invited = c.invitedPrincipal() == null || c.invitedPrincipal().isBlank()
                ? null
                : c.invitedPrincipal().trim();

        LocalDateTime now = LocalDateTime.now(clock);
        StationInviteEntity inv = new StationInviteEntity();
        inv.setStationId(stationId);
        inv.setInviteCode(inviteCodeService.newUniqueInviteCode());
        inv.setInvitedPrincipal(invited);
        inv.setInvitedBy(creator);
        inv.setRoleOnJoin(role.getSlug());
        inv.setMaxUses(c.maxUses());
        inv.setUsedCount(0);
        inv.setExpiresAt(c.expiresInHours() == null ? null : now.plusHours(c.expiresInHours()));
        inv.setActive(true);
        inv.setCreatedAt(now);
        this.save(inv);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("inviteCode", inv.getInviteCode());
        details.put("invitedPrincipal", invited);
        details.put("roleOnJoin", role.getSlug());
        details.put("maxUses", c.maxUses());
        auditLogService.record(stationId, AuditAction.INVITE_CREATE, creator, invited, details);
        return InviteDto.from(inv);
    }

    @Transactional
    @Override
    public Redeemed useInvite(String code, String principal) {
        String p = principal == null ? "" : principal.trim();
        if (p.isEmpty()) {
            throw BizException.validation("missing_principal");
        }
        String c = code == null ? "" : code.trim();
        if (c.isEmpty() || c.length() > MAX_CODE_LEN) {
            throw BizException.notFound("invite_not_found");
        }

        StationInviteEntity inv = this.getOne(new LambdaQueryWrapper<StationInviteEntity>()
                .eq(StationInviteEntity::getInviteCode, c)
                .last("limit 1"));
        if (inv == null) {
            throw BizException.notFound("invite_not_found");
        }
        if (!Boolean.TRUE.equals(inv.getActive())) {
            throw BizException.invalidState("invite_inactive");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (inv.getExpiresAt() != null && !inv.getExpiresAt().isAfter(now)) {
            throw BizException.invalidState("invite_expired");
        }
        if (inv.getMaxUses() != null && inv.getUsedCount() != null && inv.getUsedCount() >= inv.getMaxUses()) {
            throw BizException.invalidState("invite_usage_limit");
        }
        if (inv.getInvitedPrincipal() != null && !inv.getInvitedPrincipal().equals(p)) {
            throw BizException.forbidden("invite_for_other_user");
        }

        long stationId = inv.getStationId();
        StationEntity station = stationGuard.requireActive(stationId);
        if (permissionResolver.findMember(stationId, p) != null) {
            throw BizException.conflict("already_member");
        }
        if (moderationStatus.isBanned(stationId, p, now)) {
            throw BizException.invalidState("banned");
        }

        // 余量判断和计数在同一条 update 里：并发兑换也不会超过 maxUses
        if (baseMapper.incrementUsage(inv.getId()) == 0) {
            throw BizException.invalidState("invite_usage_limit");
        }

        // 角色在创建邀请后可能被删除，此时退回默认的 crew
        StationRoleEntity role = roleService.findBySlug(stationId, inv.getRoleOnJoin());
        String joinedAs;
        if (role == null) {
            memberService.addMember(station, p, SystemRole.CREW, null);
            joinedAs = SystemRole.CREW.getSlug();
        } else if (Boolean.TRUE.equals(role.getBuiltin())) {
            memberService.addMember(station, p, SystemRole.fromSlug(role.getSlug()), null);
            joinedAs = role.getSlug();
        } else {
            memberService.addMember(station, p, SystemRole.CREW, role.getId());
            joinedAs = role.getSlug();
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("inviteCode", inv.getInviteCode());
        details.put("role", joinedAs);
        auditLogService.record(stationId, AuditAction.MEMBER_JOIN_INVITE, p, null, details);
        log.info("invite redeemed: station={} principal={} role={} code={}", stationId, p, joinedAs, inv.getInviteCode());
        return new Redeemed(stationId, joinedAs);
    }

    @Transactional
    @Override
    public void revokeInvite(long inviteId, String principal) {
        StationInviteEntity inv = inviteId <= 0 ? null : this.getById(inviteId);
        if (inv == null) {
            throw BizException.notFound("invite_not_found");
        }
        permissionResolver.require(inv.getStationId(), principal, Capability.PROMOTE, "no_invite_permission");
        this.update(new LambdaUpdateWrapper<StationInviteEntity>()
                .eq(StationInviteEntity::getId, inviteId)
                .set(StationInviteEntity::getActive, false));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("inviteCode", inv.getInviteCode());
        auditLogService.record(inv.getStationId(), AuditAction.INVITE_REVOKE, principal, null, details);
    }

    @Override
    public List<InviteDto> listInvites(long stationId, String principal) {
        stationGuard.requireStation(stationId);
        permissionResolver.require(stationId, principal, Capability.PROMOTE, "no_invite_permission");
        List<StationInviteEntity> rows = this.list(new LambdaQueryWrapper<StationInviteEntity>()
                .eq(StationInviteEntity::getStationId, stationId)
                .eq(StationInviteEntity::getActive, true)
                .orderByDesc(StationInviteEntity::getCreatedAt));
        List<InviteDto> out = new ArrayList<>(rows.size());
        for (StationInviteEntity i : rows) {
            out.add(InviteDto.from(i));
        }
        return out;
    }
}
