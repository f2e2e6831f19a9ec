package com.church.chms.service;

import com.church.chms.dto.AuditLogFilter;
import com.church.chms.dto.AuditLogView;
import com.church.chms.orm.PageResult;

import java.util.List;
import java.util.Map;

/**
 * 审计日志。写入失败只记日志，不影响业务操作。
 */
public interface AuditLogService {

    String ENTITY_MEMBER = "member";

    void log(String action, String entityType, Long entityId, Map<String, ?> changes, Map<String, ?> metadata);

    void logMember(String action, Long memberId, Map<String, ?> changes);

    /**
     * 财务类操作，metadata 中 category=financial
     */
    void logFinancial(String action, String entityType, Long entityId, Map<String, ?> changes);

    /**
     * 审批结果 (approve / reject)
     */
    void logApproval(String entityType, Long entityId, String decision, String remarks);

    List<AuditLogView> getEntityLogs(String entityType, Long entityId, int limit);

    List<AuditLogView> getUserActivity(Long userId, int limit);

    PageResult<AuditLogView> search(AuditLogFilter filter, int page, int limit);

    /**
     * 删除早于 daysToKeep 天的记录，返回删除行数
     */
    int cleanup(int daysToKeep);
}
