package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.PermissionRequest;
import com.church.chms.dto.PermissionView;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.PermissionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/api/permissions")
@RequiresPermission("manage_permissions")
public class PermissionController {

    private final PermissionService permissionService;

    public PermissionController(PermissionService permissionService) {
        this.permissionService = permissionService;
    }

    @PostMapping
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody PermissionRequest request) {
        Long permissionId = permissionService.create(request.getPermissionName());
        return ResponseEntity.ok(CommonResponse.success("Permission created", new CreatedId(permissionId)));
    }

    @PutMapping("/{permission_id}")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("permission_id") Long permissionId,
                                                       @Valid @RequestBody PermissionRequest request) {
        permissionService.update(permissionId, request.getPermissionName());
        return ResponseEntity.ok(CommonResponse.success("Permission updated", null));
    }

    @DeleteMapping("/{permission_id}")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("permission_id") Long permissionId) {
        permissionService.delete(permissionId);
        return ResponseEntity.ok(CommonResponse.success("Permission deleted", null));
    }

    @GetMapping("/{permission_id}")
    public ResponseEntity<CommonResponse<PermissionView>> get(@PathVariable("permission_id") Long permissionId) {
        return ResponseEntity.ok(CommonResponse.success(permissionService.get(permissionId)));
    }

    @GetMapping
    public ResponseEntity<CommonResponse<PageResult<PermissionView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String name) {
        return ResponseEntity.ok(CommonResponse.success(permissionService.getAll(page, limit, name)));
    }
}
