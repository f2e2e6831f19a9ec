package com.church.chms.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 应用配置 (chms.*)，由 application.yml 与环境变量绑定
 */
@Data
@ConfigurationProperties(prefix = "chms")
public class ChmsProperties {

    private RateLimit rateLimit = new RateLimit();
    private Audit audit = new Audit();
    private Members members = new Members();
    private Security security = new Security();
    private Web web = new Web();
    private Mail mail = new Mail();
    private Sms sms = new Sms();
    private Communication communication = new Communication();

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        private int maxAttempts = 5;
        private long windowSeconds = 300;
        // 超过该时长未活动的标识会被清理
        private long cleanupMaxAgeSeconds = 86400;
        // 过滤器对 /api/* 按客户端 IP 的限流
        private int requestsPerWindow = 120;
        private long requestWindowSeconds = 60;
    }

    @Data
    public static class Audit {
        private int retentionDays = 365;
    }

    @Data
    public static class Members {
        private long defaultRoleId = 6;
    }

    @Data
    public static class Security {
        private boolean permissionCheckEnabled = true;
        // HS256 密钥，至少 32 字节
        private String jwtSecret;
        private String jwtRefreshSecret;
        private long accessTokenTtlSeconds = 1800;
        private long refreshTokenTtlSeconds = 86400;
    }

    @Data
    public static class Web {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:8000"));
        // 只有来自这些地址的请求才采信 X-Forwarded-For
        private List<String> trustedProxies = new ArrayList<>();
    }

    @Data
    public static class Mail {
        private String fromEmail = "no-reply@alivechms.org";
        private String fromName = "AliveChMS";
    }

    @Data
    public static class Sms {
        // hubtel | textme | generic
        private String provider = "hubtel";
        private String senderId = "AliveChMS";
        private int timeoutSeconds = 15;
        private Hubtel hubtel = new Hubtel();
        private TextMe textme = new TextMe();
        private Generic generic = new Generic();
    }

    @Data
    public static class Hubtel {
        private String url = "https://smsc.hubtel.com/v1/messages/send";
        private String clientId = "";
        private String clientSecret = "";
    }

    @Data
    public static class TextMe {
        private String url = "https://api.textme.com.gh/sms/send";
        private String apiKey = "";
    }

    @Data
    public static class Generic {
        private String url = "";
        private String method = "POST";
        // 每行一个 "Name: value"
        private String headers = "";
        // 支持 {to} {message} {sender} 占位符
        private String body = "";
    }

    @Data
    public static class Communication {
        private int batchSize = 100;
        private long dispatchIntervalMs = 60000;
    }
}
