package com.ministation.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.ministation.domain.entity.StationEntity;
import com.ministation.domain.entity.StationMemberEntity;
import com.ministation.domain.enums.Capability;
import com.ministation.domain.enums.SystemRole;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * 成员关系的唯一入口：所有插入/删除都经过 {@link #addMember} / {@link #removeMember}，
 * memberCount 只在这两处变化，且每次恰好一次。
 */
public interface StationMemberService extends IService<StationMemberEntity> {

    StationMemberEntity addMember(StationEntity station, String principal, SystemRole systemRole, Long customRoleId);

    /** 不存在返回 false，不动计数。 */
    boolean removeMember(long stationId, String principal);

    MemberDto join(long stationId, String principal);

    void leave(long stationId, String principal);

    MemberDto getMembership(long stationId, String principal);

    List<MemberDto> listMembers(long stationId, Integer limit);

    List<MembershipDto> listMemberships(String principal);

    record MemberDto(
            Long stationId,
            String principal,
            String role,
            boolean customRole,
            int priority,
            Set<Capability> capabilities,
            Integer karmaEarnedHere,
            LocalDateTime joinedAt
    ) {
        public static MemberDto from(PermissionResolver.MemberAccess a) {
            StationMemberEntity m = a.member();
            return new MemberDto(m.getStationId(), m.getPrincipal(), a.roleSlug(), a.custom(), a.priority(),
                    a.capabilities(), m.getKarmaEarnedHere(), m.getJoinedAt());
        }
    }

    record MembershipDto(
            Long stationId,
            String slug,
            String name,
            String role,
            boolean owner,
            Integer karmaEarnedHere,
            LocalDateTime joinedAt
    ) {
    }
}
