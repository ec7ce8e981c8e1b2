package com.ministation.domain.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.ministation.common.api.BizException;
import com.ministation.domain.entity.StationMemberEntity;
import com.ministation.domain.entity.StationRoleEntity;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.SystemRole;
import com.ministation.domain.mapper.StationMemberMapper;
import com.ministation.domain.mapper.StationRoleMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * (station, principal, capability) → 允许 / 拒绝。
 *
 * <p>成员引用了自定义角色时，结果<b>只</b>取该角色的能力集，不与被它遮蔽的系统角色取并集；
 * 否则按系统角色的固定能力表判定。自定义角色已不存在（悬空引用）时按系统角色处理。</p>
 */
@Component
@RequiredArgsConstructor
public class PermissionResolver {

    private final StationMemberMapper memberMapper;
    private final StationRoleMapper roleMapper;

    /**
     * 成员在某 station 内的有效身份。
     *
     * @param roleSlug 有效角色的 slug（自定义角色优先）
     * @param priority 有效角色的优先级，用于角色分配的天花板判断
     * @param custom   是否通过自定义角色获得能力
     */
    public record MemberAccess(
            StationMemberEntity member,
            String roleSlug,
            int priority,
            boolean custom,
            Set<Capability> capabilities
    ) {
        public boolean has(Capability capability) {
            return capabilities.contains(capability);
        }
    }

    public static MemberAccess resolve(StationMemberEntity member, StationRoleEntity customRole) {
        if (member == null) {
            return null;
        }
        if (customRole != null) {
            Set<Capability> caps = Collections.unmodifiableSet(customRole.capabilitySet());
            int priority = customRole.getPriority() == null ? 0 : customRole.getPriority();
            return new MemberAccess(member, customRole.getSlug(), priority, true, caps);
        }
        SystemRole role = member.getSystemRole() == null ? SystemRole.CREW : member.getSystemRole();
        return new MemberAccess(member, role.getSlug(), role.getPriority(), false, role.getCapabilities());
    }

    public StationMemberEntity findMember(long stationId, String principal) {
        if (principal == null || principal.isBlank()) {
            return null;
        }
        return memberMapper.selectOne(new LambdaQueryWrapper<StationMemberEntity>()
                .eq(StationMemberEntity::getStationId, stationId)
                .eq(StationMemberEntity::getPrincipal, principal)
                .last("limit 1"));
    }

    /** 非成员返回 null。 */
    public MemberAccess access(long stationId, String principal) {
        StationMemberEntity member = findMember(stationId, principal);
        if (member == null) {
            return null;
        }
        StationRoleEntity customRole = null;
        if (member.getCustomRoleId() != null) {
            customRole = roleMapper.selectById(member.getCustomRoleId());
            if (customRole != null && (customRole.getStationId() == null || customRole.getStationId() != stationId)) {
                customRole = null;
            }
        }
        return resolve(member, customRole);
    }

    public Set<Capability> capabilities(long stationId, String principal) {
        MemberAccess a = access(stationId, principal);
        return a == null ? EnumSet.noneOf(Capability.class) : a.capabilities();
    }

    public boolean check(long stationId, String principal, Capability capability) {
        MemberAccess a = access(stationId, principal);
        return a != null && a.has(capability);
    }

    /**
     * 同 {@link #check}，拒绝时抛 PermissionDenied，消息由调用方给出。
     */
    public MemberAccess require(long stationId, String principal, Capability capability, String message) {
        MemberAccess a = access(stationId, principal);
        if (a == null || !a.has(capability)) {
            throw BizException.forbidden(message);
        }
        return a;
    }
}
