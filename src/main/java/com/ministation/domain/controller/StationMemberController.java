package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.domain.service.StationMemberService;
import jakarta.validation.Valid;
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
@RequestMapping("/station/member")
public class StationMemberController {

    private final StationMemberService memberService;

    public record StationIdRequest(@NotNull Long stationId) {
    }

    @PostMapping("/join")
    public Result<StationMemberService.MemberDto> join(@Valid @RequestBody StationIdRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(memberService.join(req.stationId(), principal));
    }

    @PostMapping("/leave")
    public Result<Void> leave(@Valid @RequestBody StationIdRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        memberService.leave(req.stationId(), principal);
        return Result.okVoid();
    }

    /** principal 为空时查调用者自己。 */
    @GetMapping("/get")
    public Result<StationMemberService.MemberDto> get(
            @RequestParam Long stationId,
            @RequestParam(required = false) String principal
    ) {
        String who = principal == null || principal.isBlank() ? PrincipalContext.getPrincipal() : principal.trim();
        if (who == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(memberService.getMembership(stationId, who));
    }

    @GetMapping("/list")
    public Result<List<StationMemberService.MemberDto>> list(
            @RequestParam Long stationId,
            @RequestParam(required = false) Integer limit
    ) {
        return Result.ok(memberService.listMembers(stationId, limit));
    }

    @GetMapping("/memberships")
    public Result<List<StationMemberService.MembershipDto>> memberships(@RequestParam(required = false) String principal) {
        String who = principal == null || principal.isBlank() ? PrincipalContext.getPrincipal() : principal.trim();
        if (who == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(memberService.listMemberships(who));
    }
}
