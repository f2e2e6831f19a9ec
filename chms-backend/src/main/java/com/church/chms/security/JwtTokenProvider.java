package com.church.chms.security;

import com.church.chms.config.ChmsProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 签发与校验 HS256 令牌。访问令牌与刷新令牌使用不同的密钥，
 * 一种令牌不能冒充另一种。
 */
@Slf4j
@Component
public class JwtTokenProvider {

    static final String CLAIM_USERNAME = "username";
    static final String CLAIM_ROLES = "roles";

    private final Key accessKey;
    private final Key refreshKey;
    private final long accessTtlSeconds;
    private final long refreshTtlSeconds;
    private final Clock clock;

    public JwtTokenProvider(ChmsProperties properties, Clock clock) {
        ChmsProperties.Security settings = properties.getSecurity();
        this.accessKey = signingKey(settings.getJwtSecret(), "chms.security.jwt-secret");
        this.refreshKey = signingKey(settings.getJwtRefreshSecret(), "chms.security.jwt-refresh-secret");
        this.accessTtlSeconds = settings.getAccessTokenTtlSeconds();
        this.refreshTtlSeconds = settings.getRefreshTokenTtlSeconds();
        this.clock = clock;
    }

    public String createAccessToken(Long memberId, String username, List<String> roles) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(memberId))
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_ROLES, roles)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(accessTtlSeconds)))
                .signWith(accessKey, SignatureAlgorithm.HS256)
                .compact();
    }

    public String createRefreshToken(Long memberId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(String.valueOf(memberId))
                // jti 保证同一秒内签发的刷新令牌也不相同
                .setId(UUID.randomUUID().toString())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(refreshTtlSeconds)))
                .signWith(refreshKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return 令牌中的成员 ID；签名错误、过期或格式不对时为空
     */
    public Optional<Long> parseAccessToken(String token) {
        return parse(token, accessKey);
    }

    public Optional<Long> parseRefreshToken(String token) {
        return parse(token, refreshKey);
    }

    public long getAccessTtlSeconds() {
        return accessTtlSeconds;
    }

    public long getRefreshTtlSeconds() {
        return refreshTtlSeconds;
    }

    private Optional<Long> parse(String token, Key key) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return Optional.of(Long.valueOf(claims.getSubject()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("令牌校验失败: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Key signingKey(String secret, String property) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException(property + " must be at least 32 bytes");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
