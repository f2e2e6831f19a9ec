package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.FamilyCreateRequest;
import com.church.chms.dto.FamilyMemberRequest;
import com.church.chms.dto.FamilyUpdateRequest;
import com.church.chms.dto.FamilyView;
import com.church.chms.dto.RoleChangeRequest;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.FamilyService;
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
@RequestMapping("/api/families")
public class FamilyController {

    private final FamilyService familyService;

    public FamilyController(FamilyService familyService) {
        this.familyService = familyService;
    }

    @PostMapping
    @RequiresPermission("manage_families")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody FamilyCreateRequest request) {
        Long familyId = familyService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Family created", new CreatedId(familyId)));
    }

    @PutMapping("/{family_id}")
    @RequiresPermission("manage_families")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("family_id") Long familyId,
                                                       @Valid @RequestBody FamilyUpdateRequest request) {
        familyService.update(familyId, request);
        return ResponseEntity.ok(CommonResponse.success("Family updated", null));
    }

    @DeleteMapping("/{family_id}")
    @RequiresPermission("manage_families")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("family_id") Long familyId) {
        familyService.delete(familyId);
        return ResponseEntity.ok(CommonResponse.success("Family deleted", null));
    }

    @GetMapping("/{family_id}")
    @RequiresPermission("view_families")
    public ResponseEntity<CommonResponse<FamilyView>> get(@PathVariable("family_id") Long familyId) {
        return ResponseEntity.ok(CommonResponse.success(familyService.get(familyId)));
    }

    @GetMapping
    @RequiresPermission("view_families")
    public ResponseEntity<CommonResponse<PageResult<FamilyView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) Long branchId,
            @RequestParam(required = false) String name) {
        return ResponseEntity.ok(CommonResponse.success(familyService.getAll(page, limit, branchId, name)));
    }

    @PostMapping("/{family_id}/members")
    @RequiresPermission("manage_families")
    public ResponseEntity<CommonResponse<Void>> addMember(@PathVariable("family_id") Long familyId,
                                                          @Valid @RequestBody FamilyMemberRequest request) {
        familyService.addMember(familyId, request.getMemberId(), request.getRole());
        return ResponseEntity.ok(CommonResponse.success("Member added to family", null));
    }

    @DeleteMapping("/{family_id}/members/{member_id}")
    @RequiresPermission("manage_families")
    public ResponseEntity<CommonResponse<Void>> removeMember(@PathVariable("family_id") Long familyId,
                                                             @PathVariable("member_id") Long memberId) {
        familyService.removeMember(familyId, memberId);
        return ResponseEntity.ok(CommonResponse.success("Member removed from family", null));
    }

    @PutMapping("/{family_id}/members/{member_id}")
    @RequiresPermission("manage_families")
    public ResponseEntity<CommonResponse<Void>> updateMemberRole(@PathVariable("family_id") Long familyId,
                                                                 @PathVariable("member_id") Long memberId,
                                                                 @Valid @RequestBody RoleChangeRequest request) {
        familyService.updateMemberRole(familyId, memberId, request.getRole());
        return ResponseEntity.ok(CommonResponse.success("Family role updated", null));
    }
}
