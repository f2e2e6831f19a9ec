package com.church.chms.scheduler;

import com.church.chms.config.ChmsProperties;
import com.church.chms.service.AuditLogService;
import com.church.chms.service.AuthService;
import com.church.chms.service.CommunicationService;
import com.church.chms.util.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 后台维护任务：消息投递、审计日志保留期清理、限流记录与过期刷新令牌清理。
 * chms.scheduling.enabled=false 时不注册 (测试环境)。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "chms.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MaintenanceScheduler {

    private final CommunicationService communicationService;
    private final AuditLogService auditLogService;
    private final AuthService authService;
    private final RateLimiter rateLimiter;
    private final ChmsProperties properties;

    public MaintenanceScheduler(CommunicationService communicationService,
                                AuditLogService auditLogService,
                                AuthService authService,
                                RateLimiter rateLimiter,
                                ChmsProperties properties) {
        this.communicationService = communicationService;
        this.auditLogService = auditLogService;
        this.authService = authService;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    @Scheduled(initialDelay = 30000, fixedDelayString = "${chms.communication.dispatch-interval-ms:60000}")
    public void dispatchCommunications() {
        try {
            communicationService.dispatchPending(properties.getCommunication().getBatchSize());
        } catch (RuntimeException e) {
            // 下一轮继续投递
            log.error("消息投递任务失败", e);
        }
    }

    // 每天凌晨 3 点
    @Scheduled(cron = "${chms.audit.cleanup-cron:0 0 3 * * *}")
    public void cleanupAuditLogs() {
        auditLogService.cleanup(properties.getAudit().getRetentionDays());
    }

    @Scheduled(initialDelay = 1, fixedRate = 1, timeUnit = TimeUnit.HOURS)
    public void cleanupRateLimits() {
        int removed = rateLimiter.cleanup(properties.getRateLimit().getCleanupMaxAgeSeconds());
        if (removed > 0) {
            log.info("限流记录清理完成, 移除 {} 个标识", removed);
        }
    }

    @Scheduled(initialDelay = 1, fixedRate = 6, timeUnit = TimeUnit.HOURS)
    public void purgeExpiredRefreshTokens() {
        int removed = authService.purgeExpiredTokens();
        if (removed > 0) {
            log.info("过期刷新令牌清理完成, 删除 {} 条", removed);
        }
    }
}
