package com.church.chms.security;

import com.church.chms.config.ChmsProperties;
import com.church.chms.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Collection;
import java.util.Optional;

/**
 * 当前请求的调用者信息：成员 ID (Bearer 访问令牌)、客户端 IP、User-Agent。
 * 在请求线程之外 (定时任务) 调用时全部返回空。
 */
@Component
public class RequestContext {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProvider tokenProvider;
    private final ChmsProperties.Web web;

    public RequestContext(JwtTokenProvider tokenProvider, ChmsProperties properties) {
        this.tokenProvider = tokenProvider;
        this.web = properties.getWeb();
    }

    /**
     * 令牌缺失或无效时为空
     */
    public Optional<Long> currentMemberId() {
        HttpServletRequest request = currentRequest();
        if (request == null) {
            return Optional.empty();
        }
        return bearerToken(request).flatMap(tokenProvider::parseAccessToken);
    }

    public Long requireMemberId() {
        HttpServletRequest request = currentRequest();
        Optional<String> token = request == null ? Optional.empty() : bearerToken(request);
        if (token.isEmpty()) {
            throw new UnauthorizedException("Authentication token missing");
        }
        return tokenProvider.parseAccessToken(token.get())
                .orElseThrow(() -> new UnauthorizedException("Invalid or expired token"));
    }

    public String clientIp() {
        HttpServletRequest request = currentRequest();
        return request == null ? null : clientIp(request, web.getTrustedProxies());
    }

    public String userAgent() {
        HttpServletRequest request = currentRequest();
        return request == null ? null : request.getHeader("User-Agent");
    }

    /**
     * 直连地址在受信代理列表中时，才取 X-Forwarded-For 的第一个地址；否则一律用直连地址
     */
    public static String clientIp(HttpServletRequest request, Collection<String> trustedProxies) {
        String remote = request.getRemoteAddr();
        if (trustedProxies == null || !trustedProxies.contains(remote)) {
            return remote;
        }
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return remote;
    }

    static Optional<String> bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    private HttpServletRequest currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes) {
            return ((ServletRequestAttributes) attributes).getRequest();
        }
        return null;
    }
}
