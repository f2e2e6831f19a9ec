package com.church.chms.controller;

import com.church.chms.dto.AuthTokens;
import com.church.chms.dto.CommonResponse;
import com.church.chms.dto.LoginRequest;
import com.church.chms.dto.RefreshTokenRequest;
import com.church.chms.service.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 登录、刷新与登出，不需要访问令牌
 */
@Validated
@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/login")
    public ResponseEntity<CommonResponse<AuthTokens>> login(@Valid @RequestBody LoginRequest request) {
        AuthTokens tokens = authService.login(request.getUsername(), request.getPassword());
        return ResponseEntity.ok(CommonResponse.success("Login successful", tokens));
    }

    @PostMapping("/refresh")
    public ResponseEntity<CommonResponse<AuthTokens>> refresh(@RequestBody RefreshTokenRequest request) {
        return ResponseEntity.ok(CommonResponse.success("Token refreshed", authService.refresh(request.getRefreshToken())));
    }

    @PostMapping("/logout")
    public ResponseEntity<CommonResponse<Void>> logout(@RequestBody RefreshTokenRequest request) {
        authService.logout(request.getRefreshToken());
        return ResponseEntity.ok(CommonResponse.success("Logged out", null));
    }
}
