package com.church.chms.filter;

import com.church.chms.config.ChmsProperties;
import com.church.chms.dto.CommonResponse;
import com.church.chms.security.RequestContext;
import com.church.chms.util.RateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 限流过滤器 - 按客户端 IP 拦截 /api/* 请求，超限时直接返回 429
 */
@Component
public class RateLimitFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final RateLimiter rateLimiter;
    private final ChmsProperties.RateLimit settings;
    private final ChmsProperties.Web web;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimiter rateLimiter, ChmsProperties properties, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.settings = properties.getRateLimit();
        this.web = properties.getWeb();
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (!settings.isEnabled()) {
            chain.doFilter(request, response);
            return;
        }

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String key = "api:" + RequestContext.clientIp(httpRequest, web.getTrustedProxies());
        int max = settings.getRequestsPerWindow();
        long window = settings.getRequestWindowSeconds();

        if (!rateLimiter.check(key, max, window)) {
            long retryAfter = rateLimiter.retryAfterSeconds(key, window);
            long minutes = (long) Math.ceil(retryAfter / 60.0);
            log.warn("拦截请求: {} {} (来源 {} 超出限流)", httpRequest.getMethod(), httpRequest.getRequestURI(), key);

            httpResponse.setStatus(429);
            httpResponse.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
            httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
            httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());

            CommonResponse<Void> errorResponse = CommonResponse.error(
                    429, "Too many requests. Please try again in " + minutes + " minute(s).");
            httpResponse.getWriter().write(objectMapper.writeValueAsString(errorResponse));
            return;
        }

        chain.doFilter(request, response);
    }
}
