package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.common.ratelimit.RateLimit;
import com.ministation.domain.service.StationInviteService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/station/invite")
public class StationInviteController {

    private final StationInviteService inviteService;

    public record CreateInviteRequest(
            @NotNull Long stationId,
            String invitedPrincipal,
            String roleOnJoin,
            Integer maxUses,
            Integer expiresInHours
    ) {
    }

    @PostMapping("/create")
    @RateLimit(name = "invite_create", windowSeconds = 60, max = 10)
    public Result<StationInviteService.InviteDto> create(@Valid @RequestBody CreateInviteRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        StationInviteService.CreateInviteCommand cmd = new StationInviteService.CreateInviteCommand(
                req.invitedPrincipal(), req.roleOnJoin(), req.maxUses(), req.expiresInHours());
        return Result.ok(inviteService.createInvite(req.stationId(), principal, cmd));
    }

    public record UseInviteRequest(@NotBlank String code) {
    }

    @PostMapping("/use")
    @RateLimit(name = "invite_use", windowSeconds = 60, max = 10)
    public Result<StationInviteService.Redeemed> use(@Valid @RequestBody UseInviteRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(inviteService.useInvite(req.code(), principal));
    }

    public record RevokeInviteRequest(@NotNull Long inviteId) {
    }

    @PostMapping("/revoke")
    public Result<Void> revoke(@Valid @RequestBody RevokeInviteRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        inviteService.revokeInvite(req.inviteId(), principal);
        return Result.okVoid();
    }

    @GetMapping("/list")
    public Result<List<StationInviteService.InviteDto>> list(@RequestParam Long stationId) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(inviteService.listInvites(stationId, principal));
    }
}
