package com.church.chms.controller;

import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.CreatedId;
import com.church.chms.dto.EventRequest;
import com.church.chms.dto.EventView;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.EventService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.format.annotation.DateTimeFormat;
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

import java.time.LocalDate;

/**
 * 活动本身的增删改查；志愿者分配见 {@link VolunteerController}
 */
@Validated
@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @PostMapping
    @RequiresPermission("manage_events")
    public ResponseEntity<CommonResponse<CreatedId>> create(@Valid @RequestBody EventRequest request) {
        Long eventId = eventService.create(request);
        return ResponseEntity.ok(CommonResponse.success("Event created", new CreatedId(eventId)));
    }

    @PutMapping("/{event_id}")
    @RequiresPermission("manage_events")
    public ResponseEntity<CommonResponse<Void>> update(@PathVariable("event_id") Long eventId,
                                                       @Valid @RequestBody EventRequest request) {
        eventService.update(eventId, request);
        return ResponseEntity.ok(CommonResponse.success("Event updated", null));
    }

    @DeleteMapping("/{event_id}")
    @RequiresPermission("manage_events")
    public ResponseEntity<CommonResponse<Void>> delete(@PathVariable("event_id") Long eventId) {
        eventService.delete(eventId);
        return ResponseEntity.ok(CommonResponse.success("Event deleted", null));
    }

    @GetMapping("/{event_id}")
    @RequiresPermission("view_events")
    public ResponseEntity<CommonResponse<EventView>> get(@PathVariable("event_id") Long eventId) {
        return ResponseEntity.ok(CommonResponse.success(eventService.get(eventId)));
    }

    @GetMapping
    @RequiresPermission("view_events")
    public ResponseEntity<CommonResponse<PageResult<EventView>>> getAll(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(name = "branch_id", required = false) Long branchId,
            @RequestParam(name = "date_from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {
        return ResponseEntity.ok(CommonResponse.success(eventService.getAll(page, limit, branchId, dateFrom, dateTo)));
    }
}
