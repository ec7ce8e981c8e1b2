package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.entity.StationMemberEntity;
import com.ministation.domain.entity.StationRoleEntity;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.SystemRole;
import com.ministation.domain.mapper.StationMemberMapper;
import com.ministation.domain.mapper.StationRoleMapper;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.PermissionResolver;
import com.ministation.domain.service.SlugService;
import com.ministation.domain.service.StationGuard;
import com.ministation.domain.service.StationRoleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class StationRoleServiceImpl extends ServiceImpl<StationRoleMapper, StationRoleEntity> implements StationRoleService {

    private static final int MAX_COLOR_LEN = 16;

    private final StationMemberMapper memberMapper;
    private final StationGuard stationGuard;
    private final PermissionResolver permissionResolver;
    private final SlugService slugService;
    private final AuditLogService auditLogService;
    private final StationProperties props;
    private final Clock clock;

    public StationRoleServiceImpl(StationMemberMapper memberMapper,
                                  StationGuard stationGuard,
                                  PermissionResolver permissionResolver,
                                  SlugService slugService,
                                  AuditLogService auditLogService,
                                  StationProperties props,
                                  Clock clock) {
        this.memberMapper = memberMapper;
        this.stationGuard = stationGuard;
        this.permissionResolver = permissionResolver;
        this.slugService = slugService;
        this.auditLogService = auditLogService;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    @Override
    public void seedSystemRoles(long stationId) {
        LocalDateTime now = LocalDateTime.now(clock);
        for (SystemRole sr : SystemRole.values()) {
            StationRoleEntity r = new StationRoleEntity();
            r.setStationId(stationId);
            r.setName(sr.getDisplayName());
            r.setSlug(sr.getSlug());
            r.setColorHint(sr.getColorHint());
            r.setCapabilities(Capability.toStored(sr.getCapabilities()));
            r.setPriority(sr.getPriority());
            r.setDefaultRole(sr.isDefaultRole());
            r.setBuiltin(true);
            r.setCreatedAt(now);
            r.setUpdatedAt(now);
            this.save(r);
        }
    }

    @Override
    public List<RoleDto> listRoles(long stationId) {
        stationGuard.requireStation(stationId);
        List<StationRoleEntity> rows = this.list(new LambdaQueryWrapper<StationRoleEntity>()
                .eq(StationRoleEntity::getStationId, stationId)
                .orderByDesc(StationRoleEntity::getPriority)
                .orderByAsc(StationRoleEntity::getId));
        List<RoleDto> out = new ArrayList<>(rows.size());
        for (StationRoleEntity r : rows) {
            out.add(RoleDto.from(r));
        }
        return out;
    }

    @Transactional
    @Override
    public RoleDto createCustomRole(long stationId, String principal, CreateRoleCommand cmd) {
        StationEntity station = stationGuard.requireStation(stationId);
        requireOwner(station, principal);
        if (cmd == null) {
            throw BizException.validation("bad_request");
        }
        String name = requireName(cmd.name());
        if (cmd.priority() == null) {
            throw BizException.validation("missing_priority");
        }
        int priority = checkPriority(cmd.priority());
        Set<Capability> caps = parseCapabilities(cmd.capabilities());
        String color = normalizeColor(cmd.colorHint());

        LocalDateTime now = LocalDateTime.now(clock);
        StationRoleEntity r = new StationRoleEntity();
        r.setStationId(stationId);
        r.setName(name);
        r.setColorHint(color);
        r.setCapabilities(Capability.toStored(caps));
        r.setPriority(priority);
        r.setDefaultRole(false);
        r.setBuiltin(false);
        r.setCreatedAt(now);
        r.setUpdatedAt(now);

        if (cmd.slug() != null && !cmd.slug().isBlank()) {
            r.setSlug(slugService.slugify(cmd.slug()));
            if (findBySlug(stationId, r.getSlug()) != null) {
                throw BizException.conflict("role_slug_exists");
            }
            try {
                baseMapper.insert(r);
            } catch (DuplicateKeyException e) {
                throw BizException.conflict("role_slug_exists");
            }
        } else {
            insertWithDerivedSlug(r, slugService.slugify(name));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roleSlug", r.getSlug());
        details.put("priority", priority);
        details.put("capabilities", r.getCapabilities());
        auditLogService.record(stationId, AuditAction.ROLE_CREATE, principal, null, details);
        return RoleDto.from(r);
    }

    private void insertWithDerivedSlug(StationRoleEntity r, String base) {
        for (int attempt = 0; attempt < SlugService.MAX_TRIES; attempt++) {
            String slug = slugService.candidate(base, attempt);
            if (findBySlug(r.getStationId(), slug) != null) {
                continue;
            }
            r.setSlug(slug);
            try {
                baseMapper.insert(r);
                return;
            } catch (DuplicateKeyException e) {
                log.debug("role slug taken concurrently: station={} slug={}", r.getStationId(), slug);
            }
        }
        throw BizException.conflict("role_slug_exists");
    }

    @Transactional
    @Override
    public RoleDto updateCustomRole(long roleId, String principal, UpdateRoleCommand cmd) {
        StationRoleEntity role = requireCustomRole(roleId);
        StationEntity station = stationGuard.requireStation(role.getStationId());
        requireOwner(station, principal);
        if (cmd == null) {
            throw BizException.validation("bad_request");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roleSlug", role.getSlug());
        LambdaUpdateWrapper<StationRoleEntity> uw = new LambdaUpdateWrapper<StationRoleEntity>()
                .eq(StationRoleEntity::getId, roleId)
                .set(StationRoleEntity::getUpdatedAt, LocalDateTime.now(clock));
        if (cmd.name() != null) {
            String name = requireName(cmd.name());
            uw.set(StationRoleEntity::getName, name);
            details.put("name", name);
        }
        if (cmd.colorHint() != null) {
            uw.set(StationRoleEntity::getColorHint, normalizeColor(cmd.colorHint()));
        }
        if (cmd.capabilities() != null) {
            String stored = Capability.toStored(parseCapabilities(cmd.capabilities()));
            uw.set(StationRoleEntity::getCapabilities, stored);
            details.put("capabilities", stored);
        }
        if (cmd.priority() != null) {
            int priority = checkPriority(cmd.priority());
            uw.set(StationRoleEntity::getPriority, priority);
            details.put("priority", priority);
        }
        this.update(uw);
        auditLogService.record(station.getId(), AuditAction.ROLE_UPDATE, principal, null, details);
        return RoleDto.from(this.getById(roleId));
    }

    @Transactional
    @Override
    public int deleteCustomRole(long roleId, String principal) {
        StationRoleEntity role = requireCustomRole(roleId);
        StationEntity station = stationGuard.requireStation(role.getStationId());
        requireOwner(station, principal);

        // 持有者必须全部回到 crew，不能留下悬空引用
        int reassigned = memberMapper.update(null, new LambdaUpdateWrapper<StationMemberEntity>()
                .eq(StationMemberEntity::getStationId, station.getId())
                .eq(StationMemberEntity::getCustomRoleId, roleId)
                .set(StationMemberEntity::getSystemRole, SystemRole.CREW)
                .setSql("custom_role_id = null")
                .set(StationMemberEntity::getUpdatedAt, LocalDateTime.now(clock)));
        this.removeById(roleId);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roleSlug", role.getSlug());
        details.put("reassigned", reassigned);
        auditLogService.record(station.getId(), AuditAction.ROLE_DELETE, principal, null, details);
        log.info("custom role deleted: station={} role={} reassigned={}", station.getId(), role.getSlug(), reassigned);
        return reassigned;
    }

    @Transactional
    @Override
    public void assignRole(long stationId, String assigner, String target, String roleSlug) {
        StationEntity station = stationGuard.requireStation(stationId);
        PermissionResolver.MemberAccess access =
                permissionResolver.require(stationId, assigner, Capability.PROMOTE, "no_promote_permission");

        if (target == null || target.isBlank()) {
            throw BizException.validation("missing_target");
        }
        if (StationGuard.isOwner(station, target)) {
            throw BizException.forbidden("cannot_change_owner_role");
        }
        PermissionResolver.MemberAccess targetAccess = permissionResolver.access(stationId, target);
        if (targetAccess == null) {
            throw BizException.notFound("not_member");
        }
        // 非 owner 不能改动与自己同级或更高的成员
        if (!StationGuard.isOwner(station, assigner) && targetAccess.priority() >= access.priority()) {
            throw BizException.forbidden("target_outranks_assigner");
        }

        StationRoleEntity role = requireAssignable(stationId, access, roleSlug);

        LambdaUpdateWrapper<StationMemberEntity> uw = new LambdaUpdateWrapper<StationMemberEntity>()
                .eq(StationMemberEntity::getId, targetAccess.member().getId())
                .set(StationMemberEntity::getUpdatedAt, LocalDateTime.now(clock));
        if (Boolean.TRUE.equals(role.getBuiltin())) {
            uw.set(StationMemberEntity::getSystemRole, SystemRole.fromSlug(role.getSlug()))
                    .setSql("custom_role_id = null");
        } else {
            uw.set(StationMemberEntity::getSystemRole, SystemRole.CREW)
                    .set(StationMemberEntity::getCustomRoleId, role.getId());
        }
        memberMapper.update(null, uw);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fromRole", targetAccess.roleSlug());
        details.put("toRole", role.getSlug());
        auditLogService.record(stationId, AuditAction.ROLE_ASSIGN, assigner, target, details);
    }

    @Override
    public StationRoleEntity findBySlug(long stationId, String slug) {
        if (slug == null || slug.isBlank()) {
            return null;
        }
        return this.getOne(new LambdaQueryWrapper<StationRoleEntity>()
                .eq(StationRoleEntity::getStationId, stationId)
                .eq(StationRoleEntity::getSlug, slug.trim())
                .last("limit 1"));
    }

    @Override
    public StationRoleEntity requireAssignable(long stationId, PermissionResolver.MemberAccess assigner, String roleSlug) {
        StationRoleEntity role = findBySlug(stationId, roleSlug);
        if (role == null) {
            throw BizException.notFound("role_not_found");
        }
        if (SystemRole.CAPTAIN.getSlug().equals(role.getSlug())) {
            throw BizException.forbidden("cannot_assign_captain");
        }
        int rolePriority = role.getPriority() == null ? 0 : role.getPriority();

        // co-captain 的硬性天花板：不能授予优先级 >= 90 的角色（不能制造同级或上级）。
        // 与通用能力判断分开，不要并进 PermissionResolver。
        if (!assigner.custom()
                && assigner.member().getSystemRole() == SystemRole.CO_CAPTAIN
                && rolePriority >= SystemRole.CO_CAPTAIN.getPriority()) {
            throw BizException.forbidden("co_captain_priority_ceiling");
        }

        // 通过自定义角色获得 promote 的成员，只能授予严格低于自身优先级的角色
        if (assigner.custom() && rolePriority >= assigner.priority()) {
            throw BizException.forbidden("role_priority_ceiling");
        }
        return role;
    }

    private StationRoleEntity requireCustomRole(long roleId) {
        StationRoleEntity role = roleId <= 0 ? null : this.getById(roleId);
        if (role == null) {
            throw BizException.notFound("role_not_found");
        }
        if (Boolean.TRUE.equals(role.getBuiltin())) {
            throw BizException.forbidden("system_role_immutable");
        }
        return role;
    }

    private static void requireOwner(StationEntity station, String principal) {
        if (!StationGuard.isOwner(station, principal)) {
            throw BizException.forbidden("only_owner_can_manage_roles");
        }
    }

    private static int checkPriority(int priority) {
        if (priority < 0) {
            throw BizException.validation("bad_priority");
        }
        if (priority >= SystemRole.OWNER_PRIORITY) {
            throw BizException.invalidState("priority_too_high");
        }
        return priority;
    }

    private static Set<Capability> parseCapabilities(List<String> codes) {
        Set<Capability> caps = Capability.fromCodes(codes);
        if (caps == null) {
            throw BizException.validation("unknown_capability");
        }
        return caps;
    }

    private String requireName(String name) {
        String n = name == null ? "" : name.trim();
        if (n.isEmpty()) {
            throw BizException.validation("missing_name");
        }
        if (n.length() > props.getMaxNameLength()) {
            throw BizException.validation("name_too_long");
        }
        return n;
    }

    private static String normalizeColor(String color) {
        if (color == null || color.isBlank()) {
            return null;
        }
        String c = color.trim();
        if (c.length() > MAX_COLOR_LEN) {
            throw BizException.validation("bad_color");
        }
        return c;
    }
}
