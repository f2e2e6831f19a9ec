package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.GroupTypeRequest;
import com.church.chms.entity.GroupType;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.GroupTypeService;
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
@RequestMapping("/api/group-types")
public class GroupTypeController {

    private final GroupTypeService groupTypeService;

    public GroupTypeController(GroupTypeService groupTypeService) {
        this.groupTypeService = groupTypeService;
    }

    @PostMapping
    @RequiresPermission("manage_group_types")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody GroupTypeRequest request) {
        Long typeId = groupTypeService.create(request.getTypeName());
        return ResponseEntity.ok(CommonResponse.success("Group type created", new CreatedId(typeId)));
    }

    @PutMapping("/{type_id}")
    @RequiresPermission("manage_group_types")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("type_id") Long typeId,
                                                       @Valid @RequestBody GroupTypeRequest request) {
        groupTypeService.update(typeId, request.getTypeName());
        return ResponseEntity.ok(CommonResponse.success("Group type updated", null));
    }

    @DeleteMapping("/{type_id}")
    @RequiresPermission("manage_group_types")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("type_id") Long typeId) {
        groupTypeService.delete(typeId);
        return ResponseEntity.ok(CommonResponse.success("Group type deleted", null));
    }

    @GetMapping("/{type_id}")
    @RequiresPermission("view_group_type")
    public ResponseEntity<CommonResponse<GroupType>> get(@PathVariable("type_id") Long typeId) {
        return ResponseEntity.ok(CommonResponse.success(groupTypeService.get(typeId)));
    }

    @GetMapping
    @RequiresPermission("view_group_type")
    public ResponseEntity<CommonResponse<PageResult<GroupType>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(required = false) String name) {
        return ResponseEntity.ok(CommonResponse.success(groupTypeService.getAll(page, limit, name)));
    }
}
