package com.ministation.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.ministation.common.api.BizException;
import com.ministation.domain.config.StationProperties;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.entity.StationMemberEntity;
import com.ministation.domain.entity.StationRoleEntity;
import com.ministation.domain.enums.SystemRole;
import com.ministation.domain.mapper.StationMapper;
import com.ministation.domain.mapper.StationMemberMapper;
import com.ministation.domain.mapper.StationRoleMapper;
import com.ministation.domain.service.ModerationStatus;
import com.ministation.domain.service.PermissionResolver;
import com.ministation.domain.service.StationGuard;
import com.ministation.domain.service.StationMemberService;
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
public class StationMemberServiceImpl extends ServiceImpl<StationMemberMapper, StationMemberEntity> implements StationMemberService {

    private final StationMapper stationMapper;
    private final StationRoleMapper roleMapper;
    private final StationGuard stationGuard;
    private final PermissionResolver permissionResolver;
    private final ModerationStatus moderationStatus;
    private final StationProperties props;
    private final Clock clock;

    public StationMemberServiceImpl(StationMapper stationMapper,
                                    StationRoleMapper roleMapper,
                                    StationGuard stationGuard,
                                    PermissionResolver permissionResolver,
                                    ModerationStatus moderationStatus,
                                    StationProperties props,
                                    Clock clock) {
        this.stationMapper = stationMapper;
        this.roleMapper = roleMapper;
        this.stationGuard = stationGuard;
        this.permissionResolver = permissionResolver;
        this.moderationStatus = moderationStatus;
        this.props = props;
        this.clock = clock;
    }

    @Transactional
    @Override
    public StationMemberEntity addMember(StationEntity station, String principal, SystemRole systemRole, Long customRoleId) {
        if (station == null || station.getId() == null || principal == null || principal.isBlank()) {
            throw BizException.validation("bad_request");
        }
        long stationId = station.getId();
        if (permissionResolver.findMember(stationId, principal) != null) {
            throw BizException.conflict("already_member");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        StationMemberEntity m = new StationMemberEntity();
        m.setStationId(stationId);
        m.setPrincipal(principal);
        m.setSystemRole(systemRole == null ? SystemRole.CREW : systemRole);
        m.setCustomRoleId(customRoleId);
        m.setKarmaEarnedHere(0);
        m.setJoinedAt(now);
        m.setUpdatedAt(now);
        try {
            baseMapper.insert(m);
        } catch (DuplicateKeyException e) {
            throw BizException.conflict("already_member");
        }
        stationMapper.adjustMemberCount(stationId, 1);
        return m;
    }

    @Transactional
    @Override
    public boolean removeMember(long stationId, String principal) {
        int deleted = baseMapper.delete(new LambdaQueryWrapper<StationMemberEntity>()
                .eq(StationMemberEntity::getStationId, stationId)
                .eq(StationMemberEntity::getPrincipal, principal));
        if (deleted <= 0) {
            return false;
        }
        stationMapper.adjustMemberCount(stationId, -deleted);
        return true;
    }

    @Transactional
    @Override
    public MemberDto join(long stationId, String principal) {
        StationEntity station = stationGuard.requireActive(stationId);
        if (permissionResolver.findMember(stationId, principal) != null) {
            throw BizException.conflict("already_member");
        }
        if (moderationStatus.isBanned(stationId, principal, LocalDateTime.now(clock))) {
            throw BizException.invalidState("banned");
        }
        addMember(station, principal, SystemRole.CREW, null);
        return MemberDto.from(permissionResolver.access(stationId, principal));
    }

    @Transactional
    @Override
    public void leave(long stationId, String principal) {
        StationEntity station = stationGuard.requireStation(stationId);
        if (StationGuard.isOwner(station, principal)) {
            throw BizException.forbidden("owner_cannot_leave");
        }
        if (!removeMember(stationId, principal)) {
            throw BizException.notFound("not_member");
        }
    }

    @Override
    public MemberDto getMembership(long stationId, String principal) {
        stationGuard.requireStation(stationId);
        PermissionResolver.MemberAccess access = permissionResolver.access(stationId, principal);
        if (access == null) {
            throw BizException.notFound("not_member");
        }
        return MemberDto.from(access);
    }

    @Override
    public List<MemberDto> listMembers(long stationId, Integer limit) {
        stationGuard.requireStation(stationId);
        int n = props.clampLimit(limit, props.getMaxListLimit());
        List<StationMemberEntity> rows = this.list(new LambdaQueryWrapper<StationMemberEntity>()
                .eq(StationMemberEntity::getStationId, stationId)
                .orderByAsc(StationMemberEntity::getJoinedAt)
                .orderByAsc(StationMemberEntity::getId)
                .last("limit " + n));

        Map<Long, StationRoleEntity> customRoles = new HashMap<>();
        for (StationRoleEntity r : roleMapper.selectList(new LambdaQueryWrapper<StationRoleEntity>()
                .eq(StationRoleEntity::getStationId, stationId)
                .eq(StationRoleEntity::getBuiltin, false))) {
            customRoles.put(r.getId(), r);
        }

        List<MemberDto> out = new ArrayList<>(rows.size());
        for (StationMemberEntity m : rows) {
            StationRoleEntity custom = m.getCustomRoleId() == null ? null : customRoles.get(m.getCustomRoleId());
            out.add(MemberDto.from(PermissionResolver.resolve(m, custom)));
        }
        return out;
    }

    @Override
    public List<MembershipDto> listMemberships(String principal) {
        if (principal == null || principal.isBlank()) {
            return List.of();
        }
        List<StationMemberEntity> rows = this.list(new LambdaQueryWrapper<StationMemberEntity>()
                .eq(StationMemberEntity::getPrincipal, principal)
                .orderByDesc(StationMemberEntity::getJoinedAt));
        if (rows.isEmpty()) {
            return List.of();
        }
        Set<Long> stationIds = new HashSet<>();
        Set<Long> roleIds = new HashSet<>();
        for (StationMemberEntity m : rows) {
            stationIds.add(m.getStationId());
            if (m.getCustomRoleId() != null) {
                roleIds.add(m.getCustomRoleId());
            }
        }
        Map<Long, StationEntity> stations = new HashMap<>();
        for (StationEntity s : stationMapper.selectBatchIds(stationIds)) {
            stations.put(s.getId(), s);
        }
        Map<Long, StationRoleEntity> roles = new HashMap<>();
        if (!roleIds.isEmpty()) {
            for (StationRoleEntity r : roleMapper.selectBatchIds(roleIds)) {
                roles.put(r.getId(), r);
            }
        }

        List<MembershipDto> out = new ArrayList<>(rows.size());
        for (StationMemberEntity m : rows) {
            StationEntity s = stations.get(m.getStationId());
            if (s == null) {
                continue;
            }
            StationRoleEntity custom = m.getCustomRoleId() == null ? null : roles.get(m.getCustomRoleId());
            PermissionResolver.MemberAccess a = PermissionResolver.resolve(m, custom);
            out.add(new MembershipDto(s.getId(), s.getSlug(), s.getName(), a.roleSlug(),
                    StationGuard.isOwner(s, principal), m.getKarmaEarnedHere(), m.getJoinedAt()));
        }
        return out;
    }
}
