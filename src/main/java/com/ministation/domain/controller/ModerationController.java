package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.domain.service.ModerationService;
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
@RequestMapping("/station/moderation")
public class ModerationController {

    private final ModerationService moderationService;

    public record RestrictRequest(
            @NotNull Long stationId,
            @NotBlank String target,
            String reason,
            Integer durationHours
    ) {
    }

    public record LiftRequest(@NotNull Long stationId, @NotBlank String target) {
    }

    public record LiftResponse(Integer lifted) {
    }

    /** durationHours 为空表示永久封禁。 */
    @PostMapping("/ban")
    public Result<ModerationService.ModerationDto> ban(@Valid @RequestBody RestrictRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(moderationService.ban(req.stationId(), principal, req.target(), req.reason(), req.durationHours()));
    }

    @PostMapping("/unban")
    public Result<Void> unban(@Valid @RequestBody LiftRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        moderationService.unban(req.stationId(), principal, req.target());
        return Result.okVoid();
    }

    @PostMapping("/mute")
    public Result<ModerationService.ModerationDto> mute(@Valid @RequestBody RestrictRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(moderationService.mute(req.stationId(), principal, req.target(), req.reason(), req.durationHours()));
    }

    @PostMapping("/unmute")
    public Result<LiftResponse> unmute(@Valid @RequestBody LiftRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(new LiftResponse(moderationService.unmute(req.stationId(), principal, req.target())));
    }

    @GetMapping("/status")
    public Result<ModerationService.MemberStatus> status(
            @RequestParam Long stationId,
            @RequestParam(required = false) String principal
    ) {
        String who = principal == null || principal.isBlank() ? PrincipalContext.getPrincipal() : principal.trim();
        if (who == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(moderationService.memberStatus(stationId, who));
    }

    @GetMapping("/active")
    public Result<List<ModerationService.ModerationDto>> active(@RequestParam Long stationId) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(moderationService.listActive(stationId, principal));
    }
}
