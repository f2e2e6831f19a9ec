package com.church.chms.controller;

import com.church.chms.dto.AssignmentEndRequest;
import com.church.chms.dto.AssignmentFilter;
import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.MembershipAssignmentRequest;
import com.church.chms.dto.MembershipAssignmentView;
import com.church.chms.dto.MembershipTypeRequest;
import com.church.chms.entity.MembershipType;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.MembershipTypeService;
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
@RequestMapping("/api/membership-types")
public class MembershipTypeController {

    private final MembershipTypeService membershipTypeService;

    public MembershipTypeController(MembershipTypeService membershipTypeService) {
        this.membershipTypeService = membershipTypeService;
    }

    @PostMapping
    @RequiresPermission("manage_membership_types")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody MembershipTypeRequest request) {
        Long typeId = membershipTypeService.createType(request);
        return ResponseEntity.ok(CommonResponse.success("Membership type created", new CreatedId(typeId)));
    }

    @PutMapping("/{type_id}")
    @RequiresPermission("manage_membership_types")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("type_id") Long typeId,
                                                       @Valid @RequestBody MembershipTypeRequest request) {
        membershipTypeService.updateType(typeId, request);
        return ResponseEntity.ok(CommonResponse.success("Membership type updated", null));
    }

    @DeleteMapping("/{type_id}")
    @RequiresPermission("manage_membership_types")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("type_id") Long typeId) {
        membershipTypeService.deleteType(typeId);
        return ResponseEntity.ok(CommonResponse.success("Membership type deleted", null));
    }

    @GetMapping("/{type_id}")
    @RequiresPermission("view_membership_types")
    public ResponseEntity<CommonResponse<MembershipType>> get(@PathVariable("type_id") Long typeId) {
        return ResponseEntity.ok(CommonResponse.success(membershipTypeService.getType(typeId)));
    }

    @GetMapping
    @RequiresPermission("view_membership_types")
    public ResponseEntity<CommonResponse<PageResult<MembershipType>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String name) {
        return ResponseEntity.ok(CommonResponse.success(membershipTypeService.getAllTypes(page, limit, name)));
    }

    // ---- 成员会籍分配 ----

    @PostMapping("/members/{member_id}")
    @RequiresPermission("manage_membership_types")
    public ResponseEntity<CommonResponse<CreatedId>> assign(@PathVariable("member_id") Long memberId,
                                                            @Valid @RequestBody MembershipAssignmentRequest request) {
        Long assignmentId = membershipTypeService.assignType(memberId, request);
        return ResponseEntity.ok(CommonResponse.success("Membership type assigned", new CreatedId(assignmentId)));
    }

    @PutMapping("/assignments/{assignment_id}")
    @RequiresPermission("manage_membership_types")
    public ResponseEntity<CommonResponse<Void>> updateAssignment(@PathVariable("assignment_id") Long assignmentId,
                                                                 @Valid @RequestBody AssignmentEndRequest request) {
        membershipTypeService.updateAssignment(assignmentId, request.getEndDate());
        return ResponseEntity.ok(CommonResponse.success("Membership assignment updated", null));
    }

    @GetMapping("/members/{member_id}")
    @RequiresPermission("view_membership_types")
    public ResponseEntity<CommonResponse<List<MembershipAssignmentView>>> getMemberAssignments(
            @PathVariable("member_id") Long memberId, AssignmentFilter filter) {
        return ResponseEntity.ok(CommonResponse.success(membershipTypeService.getMemberAssignments(memberId, filter)));
    }
}
