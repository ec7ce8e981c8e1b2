package com.ministation.domain.controller;

import com.ministation.auth.web.PrincipalContext;
import com.ministation.common.api.ApiCodes;
import com.ministation.common.api.Result;
import com.ministation.domain.service.StationRoleService;
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
@RequestMapping("/station/role")
public class StationRoleController {

    private final StationRoleService roleService;

    @GetMapping("/list")
    public Result<List<StationRoleService.RoleDto>> list(@RequestParam Long stationId) {
        return Result.ok(roleService.listRoles(stationId));
    }

    public record CreateRoleRequest(
            @NotNull Long stationId,
            String name,
            String slug,
            String colorHint,
            List<String> capabilities,
            Integer priority
    ) {
    }

    @PostMapping("/create")
    public Result<StationRoleService.RoleDto> create(@Valid @RequestBody CreateRoleRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        StationRoleService.CreateRoleCommand cmd = new StationRoleService.CreateRoleCommand(
                req.name(), req.slug(), req.colorHint(), req.capabilities(), req.priority());
        return Result.ok(roleService.createCustomRole(req.stationId(), principal, cmd));
    }

    public record UpdateRoleRequest(
            @NotNull Long roleId,
            String name,
            String colorHint,
            List<String> capabilities,
            Integer priority
    ) {
    }

    @PostMapping("/update")
    public Result<StationRoleService.RoleDto> update(@Valid @RequestBody UpdateRoleRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        StationRoleService.UpdateRoleCommand cmd = new StationRoleService.UpdateRoleCommand(
                req.name(), req.colorHint(), req.capabilities(), req.priority());
        return Result.ok(roleService.updateCustomRole(req.roleId(), principal, cmd));
    }

    public record DeleteRoleRequest(@NotNull Long roleId) {
    }

    public record DeleteRoleResponse(Integer reassigned) {
    }

    @PostMapping("/delete")
    public Result<DeleteRoleResponse> delete(@Valid @RequestBody DeleteRoleRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        return Result.ok(new DeleteRoleResponse(roleService.deleteCustomRole(req.roleId(), principal)));
    }

    public record AssignRoleRequest(@NotNull Long stationId, @NotBlank String target, @NotBlank String roleSlug) {
    }

    @PostMapping("/assign")
    public Result<Void> assign(@Valid @RequestBody AssignRoleRequest req) {
        String principal = PrincipalContext.getPrincipal();
        if (principal == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        roleService.assignRole(req.stationId(), principal, req.target().trim(), req.roleSlug().trim());
        return Result.okVoid();
    }
}
