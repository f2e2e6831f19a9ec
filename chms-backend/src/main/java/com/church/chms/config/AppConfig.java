package com.church.chms.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class AppConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    // 短信网关调用的 HTTP 客户端
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ChmsProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getSms().getTimeoutSeconds());
        return builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
