package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.RoleRequest;
import com.church.chms.entity.Role;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.RoleService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/roles")
public class RoleController {

    private final RoleService roleService;

    public RoleController(RoleService roleService) {
        this.roleService = roleService;
    }

    @PostMapping
    @RequiresPermission("manage_roles")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody RoleRequest request) {
        Long roleId = roleService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Role created", new CreatedId(roleId)));
    }

    @PutMapping("/{role_id}")
    @RequiresPermission("manage_roles")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("role_id") Long roleId,
                                                       @Valid @RequestBody RoleRequest request) {
        roleService.update(roleId, request);
        return ResponseEntity.ok(CommonResponse.success("Role updated", null));
    }

    @DeleteMapping("/{role_id}")
    @RequiresPermission("manage_roles")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("role_id") Long roleId) {
        roleService.delete(roleId);
        return ResponseEntity.ok(CommonResponse.success("Role deleted", null));
    }

    @GetMapping
    @RequiresPermission("view_roles")
    public ResponseEntity<CommonResponse<List<Role>>> getAll() {
        return ResponseEntity.ok(CommonResponse.success(roleService.getAll()));
    }

    @PostMapping("/{role_id}/permissions/{permission_id}")
    @RequiresPermission("manage_roles")
    public ResponseEntity<CommonResponse<Void>> assignPermission(@PathVariable("role_id") Long roleId,
                                                                 @PathVariable("permission_id") Long permissionId) {
        roleService.assignPermission(roleId, permissionId);
        return ResponseEntity.ok(CommonResponse.success("Permission assigned to role", null));
    }

    @DeleteMapping("/{role_id}/permissions/{permission_id}")
    @RequiresPermission("manage_roles")
    public ResponseEntity<CommonResponse<Void>> removePermission(@PathVariable("role_id") Long roleId,
                                                                 @PathVariable("permission_id") Long permissionId) {
        roleService.removePermission(roleId, permissionId);
        return ResponseEntity.ok(CommonResponse.success("Permission removed from role", null));
    }
}
