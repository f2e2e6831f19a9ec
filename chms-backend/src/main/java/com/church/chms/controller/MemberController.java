package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.MemberRegistrationRequest;
import com.church.chms.dto.MemberRoleRequest;
import com.church.chms.dto.MemberUpdateRequest;
import com.church.chms.dto.MemberView;
import com.church.chms.dto.PhoneRequest;
import com.church.chms.entity.MemberPhone;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.MemberService;
import com.church.chms.service.RoleService;
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

import java.util.List;

@Validated
@RestController
@RequestMapping("/api/members")
public class MemberController {

    private final MemberService memberService;
    private final RoleService roleService;

    public MemberController(MemberService memberService, RoleService roleService) {
        this.memberService = memberService;
        this.roleService = roleService;
    }

    @PostMapping
    @RequiresPermission("create_members")
    public ResponseEntity<CommonResponse<CreatedId>> register(@Valid @RequestBody MemberRegistrationRequest request) {
        Long memberId = memberService.register(request);
        return ResponseEntity.ok(CommonResponse.success("Member registered", new CreatedId(memberId)));
    }

    @PutMapping("/{member_id}")
    @RequiresPermission("edit_members")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("member_id") Long memberId,
                                                       @Valid @RequestBody MemberUpdateRequest request) {
        memberService.update(memberId, request);
        return ResponseEntity.ok(CommonResponse.success("Member updated", null));
    }

    @DeleteMapping("/{member_id}")
    @RequiresPermission("delete_members")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("member_id") Long memberId) {
        memberService.delete(memberId);
        return ResponseEntity.ok(CommonResponse.success("Member deleted", null));
    }

    @GetMapping("/{member_id}")
    @RequiresPermission("view_members")
    public ResponseEntity<CommonResponse<MemberView>> get(@PathVariable("member_id") Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(memberService.get(memberId)));
    }

    @GetMapping
    @RequiresPermission("view_members")
    public ResponseEntity<CommonResponse<PageResult<MemberView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(CommonResponse.success(memberService.getAll(page, limit)));
    }

    // ---- 电话号码 ----

    @GetMapping("/{member_id}/phones")
    @RequiresPermission("view_members")
    public ResponseEntity<CommonResponse<List<MemberPhone>>> getPhones(@PathVariable("member_id") Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(memberService.getPhones(memberId)));
    }

    @PostMapping("/{member_id}/phones")
    @RequiresPermission("edit_members")
    public ResponseEntity<CommonResponse<CreatedId>> addPhone(@PathVariable("member_id") Long memberId,
                                                              @Valid @RequestBody PhoneRequest request) {
        Long phoneId = memberService.addPhone(memberId, request);
        return ResponseEntity.ok(CommonResponse.success("Phone number added", new CreatedId(phoneId)));
    }

    @PutMapping("/phones/{phone_id}")
    @RequiresPermission("edit_members")
    public ResponseEntity<CommonResponse<Void>> updatePhone(@PathVariable("phone_id") Long phoneId,
                                                            @Valid @RequestBody PhoneRequest request) {
        memberService.updatePhone(phoneId, request);
        return ResponseEntity.ok(CommonResponse.success("Phone number updated", null));
    }

    @DeleteMapping("/phones/{phone_id}")
    @RequiresPermission("edit_members")
    public ResponseEntity<CommonResponse<Void>> deletePhone(@PathVariable("phone_id") Long phoneId) {
        memberService.deletePhone(phoneId);
        return ResponseEntity.ok(CommonResponse.success("Phone number deleted", null));
    }

    // ---- 角色与权限 ----

    @PutMapping("/{member_id}/role")
    @RequiresPermission("manage_roles")
    public ResponseEntity<CommonResponse<Void>> assignRole(@PathVariable("member_id") Long memberId,
                                                           @Valid @RequestBody MemberRoleRequest request) {
        roleService.assignToMember(memberId, request.getRoleId());
        return ResponseEntity.ok(CommonResponse.success("Role assigned", null));
    }

    @DeleteMapping("/{member_id}/role")
    @RequiresPermission("manage_roles")
    public ResponseEntity<CommonResponse<Void>> removeRole(@PathVariable("member_id") Long memberId) {
        roleService.removeFromMember(memberId);
        return ResponseEntity.ok(CommonResponse.success("Role removed", null));
    }

    @GetMapping("/{member_id}/permissions")
    public ResponseEntity<CommonResponse<List<String>>> getPermissions(@PathVariable("member_id") Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(roleService.getMemberPermissions(memberId)));
    }
}
