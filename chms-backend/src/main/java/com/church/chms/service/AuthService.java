package com.church.chms.service;

import com.church.chms.dto.AuthTokens;

/**
 * 登录、刷新令牌与登出
 */
public interface AuthService {

    /**
     * 校验用户名密码 (只允许 Active 成员)，签发访问令牌与刷新令牌
     */
    AuthTokens login(String username, String password);

    /**
     * 用未吊销、未过期的刷新令牌换一组新令牌；旧刷新令牌随即吊销
     */
    AuthTokens refresh(String refreshToken);

    void logout(String refreshToken);

    /**
     * 删除已过期的刷新令牌，返回删除数量
     */
    int purgeExpiredTokens();
}
