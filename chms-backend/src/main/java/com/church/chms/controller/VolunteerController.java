package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.VolunteerAssignmentRequest;
import com.church.chms.dto.VolunteerAssignmentResult;
import com.church.chms.dto.VolunteerResponseRequest;
import com.church.chms.dto.VolunteerRoleRequest;
import com.church.chms.dto.VolunteerView;
import com.church.chms.entity.VolunteerRole;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.VolunteerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/api")
public class VolunteerController {

    private final VolunteerService volunteerService;

    public VolunteerController(VolunteerService volunteerService) {
        this.volunteerService = volunteerService;
    }

    @GetMapping("/volunteers/roles")
    public ResponseEntity<CommonResponse<List<VolunteerRole>>> getRoles() {
        return ResponseEntity.ok(CommonResponse.success(volunteerService.getRoles()));
    }

    @PostMapping("/volunteers/roles")
    @RequiresPermission("manage_volunteer_roles")
    public ResponseEntity<CommonResponse<CreatedId>> createRole(@Valid @RequestBody VolunteerRoleRequest request) {
        Long roleId = volunteerService.createRole(request);
        return ResponseEntity.ok(CommonResponse.success("Volunteer role created", new CreatedId(roleId)));
    }

    @PostMapping("/events/{event_id}/volunteers")
    @RequiresPermission("manage_volunteers")
    public ResponseEntity<CommonResponse<VolunteerAssignmentResult>> assign(
            @PathVariable("event_id") Long eventId,
            @Valid @RequestBody VolunteerAssignmentRequest request) {
        VolunteerAssignmentResult result = volunteerService.assign(eventId, request);
        return ResponseEntity.ok(CommonResponse.success("Volunteers assigned", result));
    }

    @GetMapping("/events/{event_id}/volunteers")
    @RequiresPermission("view_events")
    public ResponseEntity<CommonResponse<PageResult<VolunteerView>>> getByEvent(
            @PathVariable("event_id") Long eventId,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(CommonResponse.success(volunteerService.getByEvent(eventId, page, limit)));
    }

    // 由被分配的成员本人响应，不需要额外权限
    @PostMapping("/volunteers/{assignment_id}/respond")
    public ResponseEntity<CommonResponse<Void>> respond(@PathVariable("assignment_id") Long assignmentId,
                                                        @Valid @RequestBody VolunteerResponseRequest request) {
        volunteerService.confirmAssignment(assignmentId, request.getAction());
        String message = "confirm".equals(request.getAction()) ? "Assignment confirmed" : "Assignment declined";
        return ResponseEntity.ok(CommonResponse.success(message, null));
    }

    @PostMapping("/volunteers/{assignment_id}/complete")
    @RequiresPermission("manage_volunteers")
    public ResponseEntity<CommonResponse<Void>> complete(@PathVariable("assignment_id") Long assignmentId) {
        volunteerService.completeAssignment(assignmentId);
        return ResponseEntity.ok(CommonResponse.success("Assignment completed", null));
    }

    @DeleteMapping("/volunteers/{assignment_id}")
    @RequiresPermission("manage_volunteers")
    public ResponseEntity<CommonResponse<Void>> remove(@PathVariable("assignment_id") Long assignmentId) {
        volunteerService.remove(assignmentId);
        return ResponseEntity.ok(CommonResponse.success("Volunteer removed", null));
    }
}
