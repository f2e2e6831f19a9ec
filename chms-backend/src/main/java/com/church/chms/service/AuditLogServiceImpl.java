package com.church.chms.service;

import com.church.chms.dto.AuditLogFilter;
import com.church.chms.dto.AuditLogView;
import com.church.chms.orm.OrmTemplate;
import com.church.chms.orm.PageResult;
import com.church.chms.orm.QueryBuilder;
import com.church.chms.repository.AuditLogRepository;
import com.church.chms.security.RequestContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class AuditLogServiceImpl implements AuditLogService {

    private final OrmTemplate orm;
    private final AuditLogRepository auditLogRepository;
    private final RequestContext requestContext;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditLogServiceImpl(OrmTemplate orm,
                               AuditLogRepository auditLogRepository,
                               RequestContext requestContext,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.orm = orm;
        this.auditLogRepository = auditLogRepository;
        this.requestContext = requestContext;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // 独立事务：业务事务回滚时审计记录不受影响，审计失败也不会拖垮业务事务
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void log(String action, String entityType, Long entityId, Map<String, ?> changes, Map<String, ?> metadata) {
        write(action, entityType, entityId, changes, metadata);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logMember(String action, Long memberId, Map<String, ?> changes) {
        write(action, ENTITY_MEMBER, memberId, changes, null);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logFinancial(String action, String entityType, Long entityId, Map<String, ?> changes) {
        write(action, entityType, entityId, changes, Map.of("category", "financial"));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logApproval(String entityType, Long entityId, String decision, String remarks) {
        Map<String, Object> changes = new HashMap<>();
        changes.put("decision", decision);
        changes.put("remarks", remarks);
        write(decision, entityType, entityId, changes, Map.of("category", "approval"));
    }

    private void write(String action, String entityType, Long entityId, Map<String, ?> changes, Map<String, ?> metadata) {
        try {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("user_id", requestContext.currentMemberId().orElse(null));
            row.put("action", action);
            row.put("entity_type", entityType);
            row.put("entity_id", entityId);
            row.put("changes", toJson(changes));
            row.put("metadata", toJson(metadata));
            row.put("ip_address", requestContext.clientIp());
            row.put("user_agent", truncate(requestContext.userAgent(), 255));
            row.put("created_at", LocalDateTime.now(clock));
            orm.insert("audit_log", row);
        } catch (DataAccessException | JsonProcessingException e) {
            log.error("审计日志写入失败: action={}, entity={}#{}, error={}", action, entityType, entityId, e.getMessage());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLogView> getEntityLogs(String entityType, Long entityId, int limit) {
        QueryBuilder query = baseQuery()
                .where("a.entity_type", entityType)
                .where("a.entity_id", entityId)
                .orderBy("a.created_at", "DESC")
                .orderBy("a.audit_id", "DESC")
                .limit(limit);
        return orm.select(query, AuditLogView.class);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditLogView> getUserActivity(Long userId, int limit) {
        QueryBuilder query = baseQuery()
                .where("a.user_id", userId)
                .orderBy("a.created_at", "DESC")
                .orderBy("a.audit_id", "DESC")
                .limit(limit);
        return orm.select(query, AuditLogView.class);
    }

    @Override
    @Transactional(readOnly = true)
    public PageResult<AuditLogView> search(AuditLogFilter filter, int page, int limit) {
        QueryBuilder query = baseQuery()
                .whereIfPresent("a.user_id", filter.getUserId())
                .whereIfPresent("a.action", filter.getAction())
                .whereIfPresent("a.entity_type", filter.getEntityType());
        if (filter.getStartDate() != null) {
            query.where("a.created_at", ">=", filter.getStartDate().atStartOfDay());
        }
        if (filter.getEndDate() != null) {
            query.where("a.created_at", "<", filter.getEndDate().plusDays(1).atStartOfDay());
        }
        query.orderBy("a.created_at", "DESC").orderBy("a.audit_id", "DESC");
        return orm.paginate(query, page, limit, AuditLogView.class);
    }

    @Override
    @Transactional
    public int cleanup(int daysToKeep) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(daysToKeep);
        int deleted = auditLogRepository.deleteOlderThan(cutoff);
        log.info("审计日志清理完成: 删除 {} 条 {} 之前的记录", deleted, cutoff);
        return deleted;
    }

    private QueryBuilder baseQuery() {
        return QueryBuilder.from("audit_log", "a")
                .select("a.audit_id", "a.user_id", "CONCAT(m.first_name, ' ', m.family_name) AS user_name",
                        "a.action", "a.entity_type", "a.entity_id", "a.changes", "a.metadata",
                        "a.ip_address", "a.user_agent", "a.created_at")
                .leftJoin("churchmember", "m", "m.mbr_id = a.user_id");
    }

    private String toJson(Map<String, ?> value) throws JsonProcessingException {
        return value == null || value.isEmpty() ? null : objectMapper.writeValueAsString(value);
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }
}
