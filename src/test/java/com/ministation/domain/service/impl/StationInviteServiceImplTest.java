package com.ministation.domain.service.impl;

import com.ministation.common.api.ErrorKind;
import com.ministation.domain.service.StationInviteService;
import com.ministation.domain.service.StationRoleService;
import com.ministation.support.StationIntegrationSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StationInviteServiceImplTest extends StationIntegrationSupport {

    private long stationId;

    @BeforeEach
    void setUp() {
        stationId = createStation("alice", "Mars Base");
        join(stationId, "bob");
    }

    @Test
    void createInvite_Validation() {
        assertBiz(() -> inviteService.createInvite(stationId, "bob", open()),
                ErrorKind.PERMISSION_DENIED, "no_invite_permission");
        assertBiz(() -> inviteService.createInvite(stationId, "alice", cmd(null, "captain", null, null)),
                ErrorKind.PERMISSION_DENIED, "cannot_assign_captain");
        assertBiz(() -> inviteService.createInvite(stationId, "alice", cmd(null, "admiral", null, null)),
                ErrorKind.NOT_FOUND, "role_not_found");
        assertBiz(() -> inviteService.createInvite(stationId, "alice", cmd(null, null, 0, null)),
                ErrorKind.VALIDATION, "bad_max_uses");
        assertBiz(() -> inviteService.createInvite(stationId, "alice", cmd(null, null, null, 0)),
                ErrorKind.VALIDATION, "bad_expiry");
        assertThat(inviteService.count()).isZero();

        StationInviteService.InviteDto inv = inviteService.createInvite(stationId, "alice", open());
        assertThat(inv.inviteCode()).hasSize(8);
        assertThat(inv.roleOnJoin()).isEqualTo("crew");
        assertThat(inv.usedCount()).isZero();
        assertThat(inv.active()).isTrue();
    }

    @Test
    void useInvite_SingleUse_SecondRedemptionHitsUsageLimit() {
        String code = inviteService.createInvite(stationId, "alice", cmd(null, null, 1, null)).inviteCode();

        StationInviteService.Redeemed r = inviteService.useInvite(code, "carol");
        assertThat(r.stationId()).isEqualTo(stationId);
        assertThat(r.role()).isEqualTo("crew");
        assertThat(memberCount(stationId)).isEqualTo(3);

        assertBiz(() -> inviteService.useInvite(code, "dave"), ErrorKind.INVALID_STATE, "invite_usage_limit");
        assertThat(memberCount(stationId)).isEqualTo(3);
        assertThat(inviteService.listInvites(stationId, "alice").get(0).usedCount()).isEqualTo(1);
    }

    @Test
    void useInvite_EachFailureHasItsOwnReason() {
        assertBiz(() -> inviteService.useInvite("NOPE2345", "carol"), ErrorKind.NOT_FOUND, "invite_not_found");

        StationInviteService.InviteDto revoked = inviteService.createInvite(stationId, "alice", open());
        inviteService.revokeInvite(revoked.id(), "alice");
        assertBiz(() -> inviteService.useInvite(revoked.inviteCode(), "carol"), ErrorKind.INVALID_STATE, "invite_inactive");

        String expiring = inviteService.createInvite(stationId, "alice", cmd(null, null, null, 1)).inviteCode();
        clock.advance(Duration.ofHours(1));
        assertBiz(() -> inviteService.useInvite(expiring, "carol"), ErrorKind.INVALID_STATE, "invite_expired");

        String targeted = inviteService.createInvite(stationId, "alice", cmd("dave", null, null, null)).inviteCode();
        assertBiz(() -> inviteService.useInvite(targeted, "carol"), ErrorKind.PERMISSION_DENIED, "invite_for_other_user");

        StationInviteService.InviteDto openInvite = inviteService.createInvite(stationId, "alice", open());
        String code = openInvite.inviteCode();
        assertBiz(() -> inviteService.useInvite(code, "bob"), ErrorKind.CONFLICT, "already_member");

        moderationService.ban(stationId, "alice", "erin", null, null);
        assertBiz(() -> inviteService.useInvite(code, "erin"), ErrorKind.INVALID_STATE, "banned");

        // 失败的兑换不占用次数
        assertThat(inviteService.getById(openInvite.id()).getUsedCount()).isZero();

        assertThat(inviteService.useInvite(targeted, "dave").role()).isEqualTo("crew");
    }

    @Test
    void useInvite_ArchivedStation_ShouldBeRejected() {
        String code = inviteService.createInvite(stationId, "alice", open()).inviteCode();
        stationService.archive(stationId, "alice");

        assertBiz(() -> inviteService.useInvite(code, "carol"), ErrorKind.INVALID_STATE, "station_not_active");
        assertBiz(() -> inviteService.createInvite(stationId, "alice", open()), ErrorKind.INVALID_STATE, "station_not_active");
    }

    @Test
    void useInvite_ShouldGrantRoleOnJoin() {
        String modCode = inviteService.createInvite(stationId, "alice", cmd(null, "moderator", null, null)).inviteCode();
        assertThat(inviteService.useInvite(modCode, "carol").role()).isEqualTo("moderator");
        assertThat(memberService.getMembership(stationId, "carol").role()).isEqualTo("moderator");

        StationRoleService.RoleDto scout = roleService.createCustomRole(stationId, "alice",
                new StationRoleService.CreateRoleCommand("Scout", null, null, List.of("view"), 15));
        String scoutCode = inviteService.createInvite(stationId, "alice", cmd(null, "scout", null, null)).inviteCode();
        String lateCode = inviteService.createInvite(stationId, "alice", cmd(null, "scout", null, null)).inviteCode();

        inviteService.useInvite(scoutCode, "dave");
        assertThat(memberService.getMembership(stationId, "dave").role()).isEqualTo("scout");
        assertThat(memberService.getMembership(stationId, "dave").customRole()).isTrue();

        // 角色删掉之后，旧邀请退回 crew
        roleService.deleteCustomRole(scout.id(), "alice");
        assertThat(inviteService.useInvite(lateCode, "erin").role()).isEqualTo("crew");
    }

    @Test
    void coCaptainInvites_ShouldRespectCeiling() {
        roleService.assignRole(stationId, "alice", "bob", "co-captain");

        assertBiz(() -> inviteService.createInvite(stationId, "bob", cmd(null, "co-captain", null, null)),
                ErrorKind.PERMISSION_DENIED, "co_captain_priority_ceiling");
        assertThat(inviteService.createInvite(stationId, "bob", cmd(null, "moderator", null, null)).roleOnJoin())
                .isEqualTo("moderator");
    }

    @Test
    void listAndRevoke_RequirePromote() {
        StationInviteService.InviteDto inv = inviteService.createInvite(stationId, "alice", open());
        inviteService.createInvite(stationId, "alice", open());

        assertBiz(() -> inviteService.listInvites(stationId, "bob"), ErrorKind.PERMISSION_DENIED, "no_invite_permission");
        assertBiz(() -> inviteService.revokeInvite(inv.id(), "bob"), ErrorKind.PERMISSION_DENIED, "no_invite_permission");
        assertBiz(() -> inviteService.revokeInvite(12345L, "alice"), ErrorKind.NOT_FOUND, "invite_not_found");

        inviteService.revokeInvite(inv.id(), "alice");
        assertThat(inviteService.listInvites(stationId, "alice")).hasSize(1);
    }

    private static StationInviteService.CreateInviteCommand open() {
        return cmd(null, null, null, null);
    }

    private static StationInviteService.CreateInviteCommand cmd(String invited, String role, Integer maxUses, Integer hours) {
        return new StationInviteService.CreateInviteCommand(invited, role, maxUses, hours);
    }
}
