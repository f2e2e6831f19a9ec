package com.church.chms.controller;

import com.church.chms.dto.AuditLogFilter;
import com.church.chms.dto.AuditLogView;
import com.church.chms.dto.CommonResponse;
import com.church.chms.orm.PageResult;
import com.church.chms.security.RequiresPermission;
import com.church.chms.service.AuditLogService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 审计日志查询 (只读)
 */
@Validated
@RestController
@RequestMapping("/api/audit-logs")
@RequiresPermission("view_audit_logs")
public class AuditLogController {

    private final AuditLogService auditLogService;

    public AuditLogController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @GetMapping
    public ResponseEntity<CommonResponse<PageResult<AuditLogView>>> search(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "50") @Min(1) @Max(100) int limit,
            AuditLogFilter filter) {
        return ResponseEntity.ok(CommonResponse.success(auditLogService.search(filter, page, limit)));
    }

    @GetMapping("/{entity_type}/{entity_id}")
    public ResponseEntity<CommonResponse<List<AuditLogView>>> getEntityLogs(
            @PathVariable("entity_type") String entityType,
            @PathVariable("entity_id") Long entityId,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(CommonResponse.success(auditLogService.getEntityLogs(entityType, entityId, limit)));
    }

    @GetMapping("/users/{user_id}")
    public ResponseEntity<CommonResponse<List<AuditLogView>>> getUserActivity(
            @PathVariable("user_id") Long userId,
            @RequestParam(defaultValue = "100") @Min(1) @Max(500) int limit) {
        return ResponseEntity.ok(CommonResponse.success(auditLogService.getUserActivity(userId, limit)));
    }
}
