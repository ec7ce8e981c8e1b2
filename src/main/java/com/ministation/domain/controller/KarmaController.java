package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.domain.service.KarmaLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 只读：karma 只会由发帖、评论、投票间接产生。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/station/karma")
public class KarmaController {

    private final KarmaLedgerService karmaLedgerService;

    @GetMapping("/get")
    public Result<KarmaLedgerService.KarmaDto> get(@RequestParam(required = false) String principal) {
        String who = principal == null || principal.isBlank() ? PrincipalContext.getPrincipal() : principal.trim();
        if (who == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(karmaLedgerService.getKarma(who));
    }

    @GetMapping("/leaderboard")
    public Result<List<KarmaLedgerService.KarmaDto>> leaderboard(@RequestParam(required = false) Integer limit) {
        return Result.ok(karmaLedgerService.leaderboard(limit));
    }

    @GetMapping("/breakdown")
    public Result<List<KarmaLedgerService.StationKarmaDto>> breakdown(@RequestParam(required = false) String principal) {
        String who = principal == null || principal.isBlank() ? PrincipalContext.getPrincipal() : principal.trim();
        if (who == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(karmaLedgerService.breakdown(who));
    }
}
