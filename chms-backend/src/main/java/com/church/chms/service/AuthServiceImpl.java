package com.church.chms.service;

import com.church.chms.dto.AuthTokens;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.RefreshToken;
import com.church.chms.entity.UserAuthentication;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.UnauthorizedException;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.MemberRoleRepository;
import com.church.chms.repository.RefreshTokenRepository;
import com.church.chms.repository.RoleRepository;
import com.church.chms.repository.UserAuthenticationRepository;
import com.church.chms.security.JwtTokenProvider;
import com.church.chms.util.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@Transactional(readOnly = true)
public class AuthServiceImpl implements AuthService {

    private static final String TOKEN_TYPE = "Bearer";

    private final UserAuthenticationRepository authRepository;
    private final ChurchMemberRepository memberRepository;
    private final MemberRoleRepository memberRoleRepository;
    private final RoleRepository roleRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final JwtTokenProvider tokenProvider;
    private final PasswordEncoder passwordEncoder;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    public AuthServiceImpl(UserAuthenticationRepository authRepository,
                           ChurchMemberRepository memberRepository,
                           MemberRoleRepository memberRoleRepository,
                           RoleRepository roleRepository,
                           RefreshTokenRepository refreshTokenRepository,
                           JwtTokenProvider tokenProvider,
                           PasswordEncoder passwordEncoder,
                           RateLimiter rateLimiter,
                           Clock clock) {
        this.authRepository = authRepository;
        this.memberRepository = memberRepository;
        this.memberRoleRepository = memberRoleRepository;
        this.roleRepository = roleRepository;
        this.refreshTokenRepository = refreshTokenRepository;
        this.tokenProvider = tokenProvider;
        this.passwordEncoder = passwordEncoder;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    @Override
    @Transactional
    public AuthTokens login(String username, String password) {
        if (isBlank(username) || isBlank(password)) {
            throw new BadRequestException("Username and password required");
        }
        String limiterKey = "login:" + username;
        rateLimiter.enforce(limiterKey);

        UserAuthentication auth = authRepository.findByUsername(username)
                .filter(candidate -> isActiveMember(candidate.getMbrId()))
                .filter(candidate -> passwordEncoder.matches(password, candidate.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("登录失败: username={}", username);
                    return new UnauthorizedException("Invalid credentials");
                });

        rateLimiter.clear(limiterKey);
        log.info("登录成功: memberId={}", auth.getMbrId());
        return issueTokens(auth);
    }

    @Override
    @Transactional
    public AuthTokens refresh(String refreshToken) {
        RefreshToken stored = requireUsable(refreshToken);
        stored.setRevoked(true);
        refreshTokenRepository.save(stored);

        UserAuthentication auth = authRepository.findByMbrId(stored.getMbrId())
                .filter(candidate -> isActiveMember(candidate.getMbrId()))
                .orElseThrow(() -> new UnauthorizedException("Refresh token revoked or invalid"));
        return issueTokens(auth);
    }

    @Override
    @Transactional
    public void logout(String refreshToken) {
        if (isBlank(refreshToken)) {
            throw new BadRequestException("Refresh token required");
        }
        refreshTokenRepository.findByToken(refreshToken).ifPresent(stored -> {
            stored.setRevoked(true);
            refreshTokenRepository.save(stored);
            log.info("已登出: memberId={}", stored.getMbrId());
        });
    }

    @Override
    @Transactional
    public int purgeExpiredTokens() {
        return refreshTokenRepository.deleteExpired(LocalDateTime.now(clock));
    }

    /**
     * 签名有效、数据库中存在、未吊销、未过期，且签名中的成员与记录一致
     */
    private RefreshToken requireUsable(String refreshToken) {
        if (isBlank(refreshToken)) {
            throw new BadRequestException("Refresh token required");
        }
        Long memberId = tokenProvider.parseRefreshToken(refreshToken).orElse(null);
        return refreshTokenRepository.findByToken(refreshToken)
                .filter(stored -> !stored.isRevoked())
                .filter(stored -> stored.getExpiresAt().isAfter(LocalDateTime.now(clock)))
                .filter(stored -> stored.getMbrId().equals(memberId))
                .orElseThrow(() -> new UnauthorizedException("Refresh token revoked or invalid"));
    }

    private AuthTokens issueTokens(UserAuthentication auth) {
        Long memberId = auth.getMbrId();
        List<String> roles = memberRoleRepository.findByMbrId(memberId)
                .flatMap(memberRole -> roleRepository.findById(memberRole.getRoleId()))
                .map(role -> List.of(role.getRoleName()))
                .orElse(List.of());

        String accessToken = tokenProvider.createAccessToken(memberId, auth.getUsername(), roles);
        String refreshToken = tokenProvider.createRefreshToken(memberId);

        LocalDateTime now = LocalDateTime.now(clock);
        RefreshToken stored = new RefreshToken();
        stored.setMbrId(memberId);
        stored.setToken(refreshToken);
        stored.setExpiresAt(now.plusSeconds(tokenProvider.getRefreshTtlSeconds()));
        stored.setRevoked(false);
        stored.setCreatedAt(now);
        refreshTokenRepository.save(stored);

        return new AuthTokens(accessToken, refreshToken, TOKEN_TYPE, tokenProvider.getAccessTtlSeconds(),
                memberId, auth.getUsername(), roles);
    }

    private boolean isActiveMember(Long memberId) {
        return memberRepository.findByMbrIdAndDeletedFalse(memberId)
                .map(ChurchMember::isActive)
                .orElse(false);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
