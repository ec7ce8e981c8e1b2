package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.StationRoleEntity;
import com.ministation.domain.enums.Capability;

import java.util.List;
import java.util.Set;

public interface StationRoleService extends IService<StationRoleEntity> {

    /** 建站时调用：写入 captain / co-captain / moderator / crew 四行。 */
    void seedSystemRoles(long stationId);

    /** 按 priority 倒序。 */
    List<RoleDto> listRoles(long stationId);

    RoleDto createCustomRole(long stationId, String principal, CreateRoleCommand cmd);

    RoleDto updateCustomRole(long roleId, String principal, UpdateRoleCommand cmd);

    /**
     * 删除自定义角色；所有持有者回到 crew 且清空 customRoleId。返回被重置的成员数。
     */
    int deleteCustomRole(long roleId, String principal);

    void assignRole(long stationId, String assigner, String target, String roleSlug);

    /** station 内按 slug 查角色（系统角色与自定义角色同表）。 */
    StationRoleEntity findBySlug(long stationId, String slug);

    /**
     * 校验 assigner 能否把 roleSlug 授予别人（任命与邀请共用）：captain 永不可授予，
     * 以及各级优先级天花板。
     */
    StationRoleEntity requireAssignable(long stationId, PermissionResolver.MemberAccess assigner, String roleSlug);

    record CreateRoleCommand(
            String name,
            String slug,
            String colorHint,
            List<String> capabilities,
            Integer priority
    ) {
    }

    record UpdateRoleCommand(
            String name,
            String colorHint,
            List<String> capabilities,
            Integer priority
    ) {
    }

    record RoleDto(
            Long id,
            Long stationId,
            String name,
            String slug,
            String colorHint,
            Set<Capability> capabilities,
            Integer priority,
            Boolean defaultRole,
            Boolean builtin
    ) {
        public static RoleDto from(StationRoleEntity r) {
            return new RoleDto(r.getId(), r.getStationId(), r.getName(), r.getSlug(), r.getColorHint(),
                    r.capabilitySet(), r.getPriority(), r.getDefaultRole(), r.getBuiltin());
        }
    }
}
