package com.church.chms.service;

import com.church.chms.config.ChmsProperties;
import com.church.chms.dto.AuthTokens;
import com.church.chms.entity.ChurchMember;
import com.church.chms.entity.MemberRole;
import com.church.chms.entity.RefreshToken;
import com.church.chms.entity.Role;
import com.church.chms.entity.UserAuthentication;
import com.church.chms.exception.BadRequestException;
import com.church.chms.exception.RateLimitExceededException;
import com.church.chms.exception.UnauthorizedException;
import com.church.chms.repository.ChurchMemberRepository;
import com.church.chms.repository.MemberRoleRepository;
import com.church.chms.repository.RefreshTokenRepository;
import com.church.chms.repository.RoleRepository;
import com.church.chms.repository.UserAuthenticationRepository;
import com.church.chms.security.JwtTokenProvider;
import com.church.chms.util.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AuthServiceImplTest {

    @Mock
    private UserAuthenticationRepository authRepository;

    @Mock
    private ChurchMemberRepository memberRepository;

    @Mock
    private MemberRoleRepository memberRoleRepository;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private RefreshTokenRepository refreshTokenRepository;

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private JwtTokenProvider tokenProvider;
    private AuthServiceImpl authService;
    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        ChmsProperties properties = new ChmsProperties();
        properties.getSecurity().setJwtSecret("access-secret-for-tests-0123456789abcdef");
        properties.getSecurity().setJwtRefreshSecret("refresh-secret-for-tests-0123456789abcdef");
        tokenProvider = new JwtTokenProvider(properties, clock);
        authService = new AuthServiceImpl(authRepository, memberRepository, memberRoleRepository, roleRepository,
                refreshTokenRepository, tokenProvider, passwordEncoder, new RateLimiter(clock, properties), clock);
    }

    private UserAuthentication account(Long memberId, String username, String password) {
        UserAuthentication auth = new UserAuthentication();
        auth.setAuthId(1L);
        auth.setMbrId(memberId);
        auth.setUsername(username);
        auth.setPasswordHash(passwordEncoder.encode(password));
        return auth;
    }

    private ChurchMember member(Long memberId, String status) {
        ChurchMember member = new ChurchMember();
        member.setMbrId(memberId);
        member.setMembershipStatus(status);
        return member;
    }

    private RefreshToken stored(Long memberId, String token, boolean revoked) {
        RefreshToken stored = new RefreshToken();
        stored.setRefreshTokenId(9L);
        stored.setMbrId(memberId);
        stored.setToken(token);
        stored.setRevoked(revoked);
        stored.setExpiresAt(LocalDateTime.now(clock).plusDays(1));
        return stored;
    }

    @Test
    void testLogin_MissingCredentials() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> authService.login("kofi", " "));
        assertEquals("Username and password required", ex.getMessage());
        verifyNoInteractions(authRepository, refreshTokenRepository);
    }

    @Test
    void testLogin_WrongPassword() {
        when(authRepository.findByUsername("kofi")).thenReturn(Optional.of(account(7L, "kofi", "secret123")));
        when(memberRepository.findByMbrIdAndDeletedFalse(7L))
                .thenReturn(Optional.of(member(7L, ChurchMember.STATUS_ACTIVE)));

        UnauthorizedException ex = assertThrows(UnauthorizedException.class,
                () -> authService.login("kofi", "wrong-password"));
        assertEquals("Invalid credentials", ex.getMessage());
        verify(refreshTokenRepository, never()).save(any());
    }

    @Test
    void testLogin_UnknownUser() {
        when(authRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        UnauthorizedException ex = assertThrows(UnauthorizedException.class,
                () -> authService.login("ghost", "secret123"));
        assertEquals("Invalid credentials", ex.getMessage());
    }

    // 非 Active 成员即使密码正确也不能登录
    @Test
    void testLogin_InactiveMember() {
        when(authRepository.findByUsername("kofi")).thenReturn(Optional.of(account(7L, "kofi", "secret123")));
        when(memberRepository.findByMbrIdAndDeletedFalse(7L))
                .thenReturn(Optional.of(member(7L, "Inactive")));

        assertThrows(UnauthorizedException.class, () -> authService.login("kofi", "secret123"));
        verify(refreshTokenRepository, never()).save(any());
    }

    @Test
    void testLogin_Success() {
        when(authRepository.findByUsername("kofi")).thenReturn(Optional.of(account(7L, "kofi", "secret123")));
        when(memberRepository.findByMbrIdAndDeletedFalse(7L))
                .thenReturn(Optional.of(member(7L, ChurchMember.STATUS_ACTIVE)));
        when(memberRoleRepository.findByMbrId(7L)).thenReturn(Optional.of(new MemberRole(1L, 7L, 2L)));
        Role admin = new Role();
        admin.setRoleId(2L);
        admin.setRoleName("Admin");
        when(roleRepository.findById(2L)).thenReturn(Optional.of(admin));
        when(refreshTokenRepository.save(any(RefreshToken.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuthTokens tokens = authService.login("kofi", "secret123");

        assertEquals("Bearer", tokens.getTokenType());
        assertEquals(1800, tokens.getExpiresIn());
        assertEquals(7L, tokens.getMemberId());
        assertEquals(List.of("Admin"), tokens.getRoles());
        assertEquals(Optional.of(7L), tokenProvider.parseAccessToken(tokens.getAccessToken()));
        assertEquals(Optional.of(7L), tokenProvider.parseRefreshToken(tokens.getRefreshToken()));

        ArgumentCaptor<RefreshToken> captor = ArgumentCaptor.forClass(RefreshToken.class);
        verify(refreshTokenRepository).save(captor.capture());
        assertEquals(tokens.getRefreshToken(), captor.getValue().getToken());
        assertFalse(captor.getValue().isRevoked());
        assertEquals(LocalDateTime.of(2025, 3, 2, 10, 0), captor.getValue().getExpiresAt());
    }

    // 同一用户名连续失败 5 次后第 6 次直接 429
    @Test
    void testLogin_RateLimitedAfterRepeatedFailures() {
        when(authRepository.findByUsername("kofi")).thenReturn(Optional.empty());

        for (int i = 0; i < 5; i++) {
            assertThrows(UnauthorizedException.class, () -> authService.login("kofi", "guess"));
        }
        assertThrows(RateLimitExceededException.class, () -> authService.login("kofi", "guess"));
        verify(authRepository, times(5)).findByUsername("kofi");
    }

    @Test
    void testRefresh_RevokedToken() {
        String token = tokenProvider.createRefreshToken(7L);
        when(refreshTokenRepository.findByToken(token)).thenReturn(Optional.of(stored(7L, token, true)));

        UnauthorizedException ex = assertThrows(UnauthorizedException.class, () -> authService.refresh(token));
        assertEquals("Refresh token revoked or invalid", ex.getMessage());
        verify(refreshTokenRepository, never()).save(any());
    }

    @Test
    void testRefresh_ExpiredRecord() {
        String token = tokenProvider.createRefreshToken(7L);
        RefreshToken expired = stored(7L, token, false);
        expired.setExpiresAt(LocalDateTime.now(clock).minusSeconds(1));
        when(refreshTokenRepository.findByToken(token)).thenReturn(Optional.of(expired));

        assertThrows(UnauthorizedException.class, () -> authService.refresh(token));
    }

    @Test
    void testRefresh_AccessTokenRejected() {
        String accessToken = tokenProvider.createAccessToken(7L, "kofi", List.of());
        when(refreshTokenRepository.findByToken(accessToken)).thenReturn(Optional.empty());

        assertThrows(UnauthorizedException.class, () -> authService.refresh(accessToken));
    }

    @Test
    void testRefresh_MissingToken() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> authService.refresh(null));
        assertEquals("Refresh token required", ex.getMessage());
    }

    @Test
    void testRefresh_RotatesToken() {
        String token = tokenProvider.createRefreshToken(7L);
        RefreshToken current = stored(7L, token, false);
        when(refreshTokenRepository.findByToken(token)).thenReturn(Optional.of(current));
        when(authRepository.findByMbrId(7L)).thenReturn(Optional.of(account(7L, "kofi", "secret123")));
        when(memberRepository.findByMbrIdAndDeletedFalse(7L))
                .thenReturn(Optional.of(member(7L, ChurchMember.STATUS_ACTIVE)));
        when(memberRoleRepository.findByMbrId(7L)).thenReturn(Optional.empty());
        when(refreshTokenRepository.save(any(RefreshToken.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuthTokens tokens = authService.refresh(token);

        assertTrue(current.isRevoked());
        assertNotEquals(token, tokens.getRefreshToken());
        assertEquals(List.of(), tokens.getRoles());
        assertEquals(Optional.of(7L), tokenProvider.parseAccessToken(tokens.getAccessToken()));
        verify(refreshTokenRepository, times(2)).save(any(RefreshToken.class));
    }

    @Test
    void testLogout_RevokesToken() {
        RefreshToken current = stored(7L, "stored-token", false);
        when(refreshTokenRepository.findByToken("stored-token")).thenReturn(Optional.of(current));

        authService.logout("stored-token");

        assertTrue(current.isRevoked());
        verify(refreshTokenRepository).save(current);
    }

    @Test
    void testLogout_MissingToken() {
        BadRequestException ex = assertThrows(BadRequestException.class, () -> authService.logout(""));
        assertEquals("Refresh token required", ex.getMessage());
        verifyNoInteractions(refreshTokenRepository);
    }

    @Test
    void testPurgeExpiredTokens() {
        when(refreshTokenRepository.deleteExpired(LocalDateTime.of(2025, 3, 1, 10, 0))).thenReturn(3);

        assertEquals(3, authService.purgeExpiredTokens());
    }
}
