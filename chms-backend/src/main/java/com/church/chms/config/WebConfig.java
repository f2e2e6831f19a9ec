package com.church.chms.config;

import com.church.chms.security.PermissionInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web配置类：CORS 与权限拦截器
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final ChmsProperties properties;
    private final PermissionInterceptor permissionInterceptor;

    public WebConfig(ChmsProperties properties, PermissionInterceptor permissionInterceptor) {
        this.properties = properties;
        this.permissionInterceptor = permissionInterceptor;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                // 允许的源来自 chms.web.allowed-origins
                .allowedOrigins(properties.getWeb().getAllowedOrigins().toArray(new String[0]))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(permissionInterceptor).addPathPatterns("/api/**");
    }
}
