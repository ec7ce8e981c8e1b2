package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.common.ratelimit.RateLimit;
import com.ministation.domain.service.AuditLogService;
import com.ministation.domain.service.StationService;
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
@RequestMapping("/station")
public class StationController {

    private final StationService stationService;
    private final AuditLogService auditLogService;

    public record CreateStationRequest(String name, String description) {
    }

    @PostMapping("/create")
    @RateLimit(name = "station_create", windowSeconds = 60, max = 3)
    public Result<StationService.CreatedStation> create(@RequestBody CreateStationRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        if (req == null) {
            return Result.fail(ApiCodes.BAD_REQUEST, "bad_request");
        }
        return Result.ok(stationService.create(principal, req.name(), req.description()));
    }

    public record UpdateStationRequest(@NotNull Long stationId, String name, String description) {
    }

    @PostMapping("/update")
    public Result<StationService.StationDto> update(@Valid @RequestBody UpdateStationRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(stationService.update(req.stationId(), principal, req.name(), req.description()));
    }

    public record StationIdRequest(@NotNull Long stationId) {
    }

    @PostMapping("/archive")
    public Result<Void> archive(@Valid @RequestBody StationIdRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        stationService.archive(req.stationId(), principal);
        return Result.okVoid();
    }

    @GetMapping("/get")
    public Result<StationService.StationDto> get(@RequestParam Long stationId) {
        return Result.ok(stationService.get(stationId));
    }

    @GetMapping("/by-slug")
    public Result<StationService.StationDto> bySlug(@RequestParam String slug) {
        return Result.ok(stationService.getBySlug(slug));
    }

    @GetMapping("/list")
    public Result<List<StationService.StationDto>> list(@RequestParam(required = false) Integer limit) {
        return Result.ok(stationService.listActive(limit));
    }

    @GetMapping("/audit")
    public Result<List<AuditLogService.AuditEntryDto>> audit(
            @RequestParam Long stationId,
            @RequestParam(required = false) Integer limit
    ) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(auditLogService.list(stationId, principal, limit));
    }
}
