package com.church.chms.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 登录与刷新的返回值
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthTokens {

    private String accessToken;
    private String refreshToken;
    private String tokenType;
    // 访问令牌有效秒数
    private long expiresIn;
    private Long memberId;
    private String username;
    private List<String> roles;
}
