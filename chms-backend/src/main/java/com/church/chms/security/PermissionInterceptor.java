package com.church.chms.security;

import com.church.chms.config.ChmsProperties;
import com.church.chms.exception.ForbiddenException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 对带 {@link RequiresPermission} 的处理方法做权限校验
 */
@Slf4j
@Component
public class PermissionInterceptor implements HandlerInterceptor {

    private final PermissionGuard permissionGuard;
    private final RequestContext requestContext;
    private final ChmsProperties.Security settings;

    public PermissionInterceptor(PermissionGuard permissionGuard, RequestContext requestContext,
                                 ChmsProperties properties) {
        this.permissionGuard = permissionGuard;
        this.requestContext = requestContext;
        this.settings = properties.getSecurity();
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!settings.isPermissionCheckEnabled() || !(handler instanceof HandlerMethod)) {
            return true;
        }
        HandlerMethod method = (HandlerMethod) handler;
        RequiresPermission required = AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), RequiresPermission.class);
        if (required == null) {
            required = AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresPermission.class);
        }
        if (required == null) {
            return true;
        }

        Long memberId = requestContext.requireMemberId();
        if (!permissionGuard.check(memberId, required.value())) {
            log.warn("成员 {} 缺少权限 {}: {} {}", memberId, required.value(), request.getMethod(), request.getRequestURI());
            throw new ForbiddenException("Forbidden: Insufficient permissions");
        }
        return true;
    }
}
