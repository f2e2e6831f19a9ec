package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CommunicationView;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.GroupMemberView;
import com.church.chms.dto.GroupMessageRequest;
import com.church.chms.dto.GroupRequest;
import com.church.chms.dto.GroupView;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.GroupService;
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
@RequestMapping("/api/groups")
public class GroupController {

    private final GroupService groupService;

    public GroupController(GroupService groupService) {
        this.groupService = groupService;
    }

    @PostMapping
    @RequiresPermission("manage_groups")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody GroupRequest request) {
        Long groupId = groupService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Group created", new CreatedId(groupId)));
    }

    @PutMapping("/{group_id}")
    @RequiresPermission("manage_groups")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("group_id") Long groupId,
                                                       @Valid @RequestBody GroupRequest request) {
        groupService.update(groupId, request);
        return ResponseEntity.ok(CommonResponse.success("Group updated", null));
    }

    @DeleteMapping("/{group_id}")
    @RequiresPermission("manage_groups")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("group_id") Long groupId) {
        groupService.delete(groupId);
        return ResponseEntity.ok(CommonResponse.success("Group deleted", null));
    }

    @GetMapping("/{group_id}")
    @RequiresPermission("view_groups")
    public ResponseEntity<CommonResponse<GroupView>> get(@PathVariable("group_id") Long groupId) {
        return ResponseEntity.ok(CommonResponse.success(groupService.get(groupId)));
    }

    @GetMapping
    @RequiresPermission("view_groups")
    public ResponseEntity<CommonResponse<PageResult<GroupView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) Long typeId,
            @RequestParam(required = false) Long branchId,
            @RequestParam(required = false) String name) {
        return ResponseEntity.ok(CommonResponse.success(groupService.getAll(page, limit, typeId, branchId, name)));
    }

    @PostMapping("/{group_id}/members/{member_id}")
    @RequiresPermission("manage_groups")
    public ResponseEntity<CommonResponse<Void>> addMember(@PathVariable("group_id") Long groupId,
                                                          @PathVariable("member_id") Long memberId) {
        groupService.addMember(groupId, memberId);
        return ResponseEntity.ok(CommonResponse.success("Member added to group", null));
    }

    @DeleteMapping("/{group_id}/members/{member_id}")
    @RequiresPermission("manage_groups")
    public ResponseEntity<CommonResponse<Void>> removeMember(@PathVariable("group_id") Long groupId,
                                                             @PathVariable("member_id") Long memberId) {
        groupService.removeMember(groupId, memberId);
        return ResponseEntity.ok(CommonResponse.success("Member removed from group", null));
    }

    @GetMapping("/{group_id}/members")
    @RequiresPermission("view_groups")
    public ResponseEntity<CommonResponse<PageResult<GroupMemberView>>> getMembers(
            @PathVariable("group_id") Long groupId,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(CommonResponse.success(groupService.getMembers(groupId, page, limit)));
    }

    @PostMapping("/{group_id}/messages")
    @RequiresPermission("manage_groups")
    public ResponseEntity<CommonResponse<CreatedId>> sendMessage(@PathVariable("group_id") Long groupId,
                                                                 @Valid @RequestBody GroupMessageRequest request) {
        Long communicationId = groupService.sendMessage(groupId, request);
        return ResponseEntity.ok(CommonResponse.success("Message sent", new CreatedId(communicationId)));
    }

    @GetMapping("/{group_id}/messages")
    @RequiresPermission("view_groups")
    public ResponseEntity<CommonResponse<PageResult<CommunicationView>>> getMessages(
            @PathVariable("group_id") Long groupId,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(CommonResponse.success(groupService.getMessages(groupId, page, limit)));
    }
}
