package com.church.chms.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class AuditLogView {

    private Long auditId;
    private Long userId;
    private String userName;
    private String action;
    private String entityType;
    private Long entityId;
    private String changes;
    private String metadata;
    private String ipAddress;
    private String userAgent;
    private LocalDateTime createdAt;
}
