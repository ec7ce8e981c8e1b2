package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.enums.AuditAction;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.StationStatus;
import com.ministation.domain.enums.SystemRole;
import com.ministation.domain.mapper.StationMapper;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.PermissionResolver;
import com.ministation.domain.service.SlugService;
import com.ministation.domain.service.StationGuard;
import com.ministation.domain.service.StationMemberService;
import com.ministation.domain.service.StationRoleService;
import com.ministation.domain.service.StationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class StationServiceImpl extends ServiceImpl<StationMapper, StationEntity> implements StationService {

    private final StationRoleService roleService;
    private final StationMemberService memberService;
    private final SlugService slugService;
    private final StationGuard stationGuard;
    private final PermissionResolver permissionResolver;
    private final AuditLogService auditLogService;
    private final StationProperties props;
    private final Clock clock;

    public StationServiceImpl(StationRoleService roleService,
                              StationMemberService memberService,
                              SlugService slugService,
                              StationGuard stationGuard,
                              PermissionResolver permissionResolver,
                              AuditLogService auditLogService,
                              StationProperties props,
                              Clock clock) {
        this.roleService = roleService;
        this.memberService = memberService;
        this.slugService = slugService;
        this.stationGuard = stationGuard;
        this.permissionResolver = permissionResolver;
        this.auditLogService = auditLogService;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    @Override
    public CreatedStation create(String ownerPrincipal, String name, String description) {
        if (ownerPrincipal == null || ownerPrincipal.isBlank()) {
            throw BizException.validation("missing_owner");
        }
        String n = requireName(name);
        String desc = normalizeDescription(description);

        LocalDateTime now = LocalDateTime.now(clock);
        StationEntity station = insertWithUniqueSlug(slugService.slugify(n), n, desc, ownerPrincipal, now);

        roleService.seedSystemRoles(station.getId());
        memberService.addMember(station, ownerPrincipal, SystemRole.CAPTAIN, null);

        log.info("station created: id={} slug={} owner={}", station.getId(), station.getSlug(), ownerPrincipal);
        return new CreatedStation(station.getId(), station.getSlug());
    }

    /**
     * 先查再插；并发下两个请求可能查到同一个空位，这时唯一索引会让后到者失败，换下一个后缀重试。
     */
    private StationEntity insertWithUniqueSlug(String base, String name, String desc, String owner, LocalDateTime now) {
        for (int attempt = 0; attempt < SlugService.MAX_TRIES; attempt++) {
            String slug = slugService.candidate(base, attempt);
            long cnt = this.count(new LambdaQueryWrapper<StationEntity>().eq(StationEntity::getSlug, slug));
            if (cnt > 0) {
                continue;
            }
            StationEntity s = new StationEntity();
            s.setSlug(slug);
            s.setName(name);
            s.setDescription(desc);
            s.setOwnerPrincipal(owner);
            s.setMemberCount(0);
            s.setPostCount(0);
            s.setStatus(StationStatus.ACTIVE);
            s.setCreatedAt(now);
            s.setUpdatedAt(now);
            try {
                baseMapper.insert(s);
                return s;
            } catch (DuplicateKeyException e) {
                log.debug("station slug taken concurrently: {}", slug);
            }
        }
        throw BizException.conflict("slug_exists");
    }

    @Transactional
    @Override
    public StationDto update(long stationId, String principal, String name, String description) {
        StationEntity station = stationGuard.requireStation(stationId);
        permissionResolver.require(stationId, principal, Capability.SETTINGS, "no_settings_permission");
        if (name == null && description == null) {
            throw BizException.validation("nothing_to_update");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        LambdaUpdateWrapper<StationEntity> uw = new LambdaUpdateWrapper<StationEntity>()
                .eq(StationEntity::getId, stationId)
                .set(StationEntity::getUpdatedAt, LocalDateTime.now(clock));
        if (name != null) {
            String n = requireName(name);
            uw.set(StationEntity::getName, n);
            details.put("name", n);
        }
        if (description != null) {
            String d = normalizeDescription(description);
            uw.set(StationEntity::getDescription, d);
            details.put("description", d);
        }
        this.update(uw);
        auditLogService.record(stationId, AuditAction.STATION_UPDATE, principal, null, details);
        return StationDto.from(this.getById(station.getId()));
    }

    @Transactional
    @Override
    public void archive(long stationId, String principal) {
        StationEntity station = stationGuard.requireStation(stationId);
        if (!StationGuard.isOwner(station, principal)) {
            throw BizException.forbidden("only_owner_can_archive");
        }
        if (station.getStatus() == StationStatus.ARCHIVED) {
            throw BizException.invalidState("station_not_active");
        }
        this.update(new LambdaUpdateWrapper<StationEntity>()
                .eq(StationEntity::getId, stationId)
                .set(StationEntity::getStatus, StationStatus.ARCHIVED)
                .set(StationEntity::getUpdatedAt, LocalDateTime.now(clock)));
        auditLogService.record(stationId, AuditAction.STATION_ARCHIVE, principal, null, null);
        log.info("station archived: id={} by={}", stationId, principal);
    }

    @Override
    public StationDto get(long stationId) {
        return StationDto.from(stationGuard.requireStation(stationId));
    }

    @Override
    public StationDto getBySlug(String slug) {
        String s = slug == null ? "" : slug.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw BizException.validation("missing_slug");
        }
        StationEntity station = this.getOne(new LambdaQueryWrapper<StationEntity>()
                .eq(StationEntity::getSlug, s)
                .last("limit 1"));
        if (station == null) {
            throw BizException.notFound("station_not_found");
        }
        return StationDto.from(station);
    }

    @Override
    public List<StationDto> listActive(Integer limit) {
        int n = props.clampLimit(limit, props.getDefaultListLimit());
        List<StationEntity> rows = this.list(new LambdaQueryWrapper<StationEntity>()
                .eq(StationEntity::getStatus, StationStatus.ACTIVE)
                .orderByDesc(StationEntity::getCreatedAt)
                .orderByDesc(StationEntity::getId)
                .last("limit " + n));
        List<StationDto> out = new ArrayList<>(rows.size());
        for (StationEntity s : rows) {
            out.add(StationDto.from(s));
        }
        return out;
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

    private String normalizeDescription(String description) {
        if (description == null) {
            return null;
        }
        String d = description.trim();
        if (d.length() > props.getMaxDescriptionLength()) {
            throw BizException.validation("description_too_long");
        }
        return d;
    }
}
